package tech.tollgate.provider.shared;

import com.github.f4b6a3.tsid.TsidCreator;

/**
 * Record ids for codes, tokens and token families.
 *
 * <p>IDs are time-sortable, so records list in issuance order, and carry a
 * typed prefix so a code id is never mistaken for a token id in logs.
 * These ids identify records; they are never the bearer values handed to
 * clients.
 */
public final class TsidGenerator {

    /**
     * New id for a record of the given kind, e.g. "atk_0HZXEQ5Y8JY5Z".
     */
    public static String generate(EntityType type) {
        return type.prefix() + "_" + TsidCreator.getTsid();
    }

    private TsidGenerator() {
    }
}
