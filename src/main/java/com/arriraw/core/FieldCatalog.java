package com.arriraw.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered, immutable list of field descriptors for one metadata block.
 * <p>
 * Duplicate names are kept as they are (the later field wins in the decoded map) but reported,
 * since they usually point at a documentation error in the source table.
 */
public final class FieldCatalog {
    private static final Logger log = LoggerFactory.getLogger(FieldCatalog.class);

    @Getter
    private final String name;
    @Getter
    private final List<FieldDescriptor> fields;

    public FieldCatalog(String name, List<FieldDescriptor> fields) {
        this.name = Objects.requireNonNull(name, "Catalog name cannot be null");
        this.fields = List.copyOf(Objects.requireNonNull(fields, "Fields cannot be null"));
        var duplicates = duplicateNames();
        if (!duplicates.isEmpty()) {
            log.warn("Catalog {} declares duplicate field names {}", name, duplicates);
        }
    }

    public List<String> listFieldNames() {
        var names = new ArrayList<String>(fields.size());
        for (var field : fields) {
            names.add(field.getName());
        }
        return names;
    }

    public int size() {
        return fields.size();
    }

    /**
     * Names declared by more than one field, in catalog order.
     */
    public Set<String> duplicateNames() {
        var seen = new LinkedHashSet<String>();
        var duplicates = new LinkedHashSet<String>();
        for (var field : fields) {
            if (!seen.add(field.getName())) {
                duplicates.add(field.getName());
            }
        }
        return duplicates;
    }

    @Override
    public String toString() {
        return "FieldCatalog{" + name + ", " + fields.size() + " fields}";
    }
}
