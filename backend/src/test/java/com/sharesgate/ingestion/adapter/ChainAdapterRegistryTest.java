package com.sharesgate.ingestion.adapter;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ChainAdapterRegistryTest {

    @Test
    void find_byName() {
        ChainAdapter monad = adapter("monad");
        ChainAdapter sui = adapter("sui");

        ChainAdapterRegistry registry = new ChainAdapterRegistry(List.of(monad, sui));

        assertThat(registry.find("sui")).containsSame(sui);
        assertThat(registry.find("aptos")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
        assertThat(registry.all()).containsExactly(monad, sui);
    }

    @Test
    void duplicateNames_rejected() {
        List<ChainAdapter> adapters = List.of(adapter("monad"), adapter("monad"));
        assertThatThrownBy(() -> new ChainAdapterRegistry(adapters))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("monad");
    }

    private static ChainAdapter adapter(String name) {
        ChainAdapter adapter = mock(ChainAdapter.class);
        when(adapter.name()).thenReturn(name);
        return adapter;
    }
}
