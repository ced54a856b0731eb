package com.arriraw.core;

import com.arriraw.HeaderFixture;
import com.arriraw.error.ArriException;
import com.arriraw.types.DataType;
import com.arriraw.types.Value;
import com.arriraw.util.HeaderBuffer;
import org.junit.jupiter.api.Test;

import java.nio.ByteOrder;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class BlockReaderTest {

    private static FieldCatalog catalog() throws ArriException {
        return new FieldCatalog("TEST", List.of(
                FieldDescriptor.builder("field1", 0x10, DataType.UINT8).build(),
                FieldDescriptor.builder("field2", 0x11, DataType.UINT8).build(),
                FieldDescriptor.builder("field3", 0x12, DataType.UINT8).build()));
    }

    private static HeaderBuffer header() {
        return HeaderBuffer.copyOf(HeaderFixture.littleEndian().putUInt8(0x10, 1).putUInt8(0x11, 2)
                .putUInt8(0x12, 3).bytes());
    }

    @Test
    void shouldExtractOnConstruction() throws ArriException {
        var reader = new BlockReader(catalog(), new MetadataExtractor(header(), null));

        assertThat(reader.getName()).isEqualTo("TEST");
        assertThat(reader.getData().get("field2")).isEqualTo(Value.fromUnsigned(2));
        assertThat(reader.listDataNames()).containsExactly("field1", "field2", "field3");
    }

    @Test
    void shouldListCatalogFieldsIndependentlyOfAllowList() throws ArriException {
        var reader = new BlockReader(catalog(),
                new MetadataExtractor(header(), ByteOrder.LITTLE_ENDIAN, Set.of("field3"), ExtractionMode.STRICT));

        assertThat(reader.listFieldNames()).containsExactly("field1", "field2", "field3");
        assertThat(reader.listDataNames()).containsExactly("field3");
    }

    @Test
    void shouldProduceSameDataOnRefresh() throws ArriException {
        var reader = new BlockReader(catalog(), new MetadataExtractor(header(), null));
        var first = reader.getData();

        assertThat(reader.refresh()).isEqualTo(first);
    }
}
