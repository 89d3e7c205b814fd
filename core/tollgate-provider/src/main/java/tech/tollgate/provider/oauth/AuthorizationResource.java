package tech.tollgate.provider.oauth;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.*;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import tech.tollgate.provider.config.OAuthSettings;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * OAuth2 endpoints:
 * - Authorization Code flow with PKCE
 * - Token endpoint (authorization_code, refresh_token, client_credentials)
 * - Token revocation (RFC 7009) and introspection (RFC 7662)
 *
 * This resource only translates between HTTP and {@link GrantRequest} /
 * {@link GrantResponse}; all decisions are made by the {@link GrantOrchestrator}.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc6749">RFC 6749 - OAuth 2.0</a>
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7636">RFC 7636 - PKCE</a>
 */
@Path("/oauth")
@Tag(name = "OAuth2 Authorization", description = "OAuth2 authorization code flow endpoints")
public class AuthorizationResource {

    private static final Logger LOG = Logger.getLogger(AuthorizationResource.class);

    @Inject
    GrantOrchestrator orchestrator;

    @Inject
    ResourceOwnerResolver resourceOwnerResolver;

    @Inject
    OAuthSettings settings;

    @Context
    UriInfo uriInfo;

    @Context
    HttpHeaders httpHeaders;

    @Context
    SecurityContext securityContext;

    // ==================== Authorization Endpoint ====================

    /**
     * OAuth2 Authorization endpoint.
     *
     * If the user is signed in, either issues an authorization code or, for
     * clients that require consent, returns what the user is asked to approve.
     * If not, redirects to login.
     *
     * GET /oauth/authorize?
     *   response_type=code
     *   &client_id=my-spa
     *   &redirect_uri=https://app.example.com/callback
     *   &scope=read write
     *   &state=xyz123
     *   &code_challenge=E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM
     *   &code_challenge_method=S256
     */
    @GET
    @Path("/authorize")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Start authorization code flow")
    public Response authorize() {
        return handleAuthorize(HttpMethod.GET, Map.of());
    }

    /**
     * Consent submission. Carries the same parameters as the GET request plus
     * {@code allow=true} when the user approved.
     */
    @POST
    @Path("/authorize")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Approve or deny an authorization request")
    public Response approve(MultivaluedMap<String, String> form) {
        return handleAuthorize(HttpMethod.POST, form);
    }

    private Response handleAuthorize(String method, Map<String, List<String>> form) {
        Optional<String> resourceOwner = resourceOwnerResolver.resolve(securityContext);
        if (resourceOwner.isEmpty()) {
            return redirectToLogin();
        }
        GrantOutcome outcome = orchestrator.authorize(toGrantRequest(method, form), resourceOwner.get());
        return toResponse(outcome.response());
    }

    // ==================== Token Endpoint ====================

    /**
     * OAuth2 Token endpoint.
     *
     * Supports grant types:
     * - authorization_code: Exchange code for access + refresh tokens
     * - refresh_token: Exchange refresh token for new tokens
     * - client_credentials: Service-to-service authentication
     */
    @POST
    @Path("/token")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Exchange code for tokens or refresh tokens")
    public Response token(MultivaluedMap<String, String> form) {
        return toResponse(orchestrator.exchangeToken(toGrantRequest(HttpMethod.POST, form)).response());
    }

    @POST
    @Path("/revoke")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Revoke an access or refresh token")
    public Response revoke(MultivaluedMap<String, String> form) {
        return toResponse(orchestrator.revoke(toGrantRequest(HttpMethod.POST, form)).response());
    }

    @POST
    @Path("/introspect")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Check whether an access token is active")
    public Response introspect(MultivaluedMap<String, String> form) {
        return toResponse(orchestrator.introspect(toGrantRequest(HttpMethod.POST, form)).response());
    }

    // ==================== Helpers ====================

    private GrantRequest toGrantRequest(String method, Map<String, List<String>> form) {
        Map<String, String> headers = new LinkedHashMap<>();
        httpHeaders.getRequestHeaders().forEach((name, values) -> {
            if (values != null && !values.isEmpty()) {
                headers.put(name, values.get(0));
            }
        });
        return new GrantRequest(method, headers, form, uriInfo.getQueryParameters());
    }

    private Response toResponse(GrantResponse grantResponse) {
        Response.ResponseBuilder builder = Response.status(grantResponse.status());
        grantResponse.headers().forEach(builder::header);
        if (grantResponse.body() != null) {
            builder.entity(grantResponse.body()).type(MediaType.APPLICATION_JSON);
        }
        return builder.build();
    }

    private Response redirectToLogin() {
        URI requestUri = uriInfo.getRequestUri();
        String next = requestUri.getRawPath() + (requestUri.getRawQuery() != null ? "?" + requestUri.getRawQuery() : "");
        String loginUrl = settings.loginUrl();
        String location = loginUrl + (loginUrl.contains("?") ? "&" : "?") + "next=" + urlEncode(next);
        LOG.debugf("Authorization request without a signed-in user, redirecting to %s", loginUrl);
        return Response.status(Response.Status.FOUND).header(HttpHeaders.LOCATION, location).build();
    }

    private String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
