package com.arriraw.catalog;

import com.arriraw.core.BlockKind;
import com.arriraw.core.FieldCatalog;
import com.arriraw.error.ArriException;
import lombok.experimental.UtilityClass;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * The bundled catalogs of the nine header blocks. Each is loaded once and shared; catalogs are immutable.
 */
@UtilityClass
public final class CanonicalCatalogs {
    private static final Map<BlockKind, FieldCatalog> CACHE = new EnumMap<>(BlockKind.class);

    public static synchronized FieldCatalog get(BlockKind kind) throws ArriException {
        var catalog = CACHE.get(kind);
        if (catalog == null) {
            catalog = CatalogLoader.loadResource(kind.getResourceName());
            CACHE.put(kind, catalog);
        }
        return catalog;
    }

    /**
     * All nine catalogs in block processing order.
     */
    public static Map<BlockKind, FieldCatalog> all() throws ArriException {
        var result = new EnumMap<BlockKind, FieldCatalog>(BlockKind.class);
        for (var kind : BlockKind.values()) {
            result.put(kind, get(kind));
        }
        return Collections.unmodifiableMap(result);
    }
}
