package com.arriraw.core;

import com.arriraw.error.ArriException;
import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * Binds one field catalog to one extractor over a shared header and runs the extraction on construction.
 */
public final class BlockReader {
    @Getter
    private final FieldCatalog catalog;
    @Getter
    private final MetadataExtractor extractor;
    private MetadataMap data;

    public BlockReader(FieldCatalog catalog, MetadataExtractor extractor) throws ArriException {
        this.catalog = Objects.requireNonNull(catalog, "Catalog cannot be null");
        this.extractor = Objects.requireNonNull(extractor, "Extractor cannot be null");
        this.data = extractor.extract(catalog);
    }

    /**
     * Every field name the catalog declares, whether or not it was extracted.
     */
    public List<String> listFieldNames() {
        return catalog.listFieldNames();
    }

    /**
     * Names present in the last extraction. Frame line and user fields contribute their expanded names.
     */
    public List<String> listDataNames() {
        return data.nameList();
    }

    public MetadataMap getData() {
        return data;
    }

    /**
     * Run the extraction again. Decoding is deterministic, so the result equals the previous one.
     */
    public MetadataMap refresh() throws ArriException {
        this.data = extractor.extract(catalog);
        return data;
    }

    public String getName() {
        return catalog.getName();
    }
}
