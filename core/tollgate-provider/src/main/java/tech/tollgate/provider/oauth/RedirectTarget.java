package tech.tollgate.provider.oauth;

/**
 * A client and redirect URI that have been checked against the registration,
 * so errors may safely be delivered there.
 *
 * @param explicit whether the request named the redirect URI itself
 */
public record RedirectTarget(OAuthClient client, String redirectUri, boolean explicit) {
}
