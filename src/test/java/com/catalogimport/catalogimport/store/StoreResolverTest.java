package com.catalogimport.catalogimport.store;

import com.catalogimport.catalogimport.catalog.StoreDirectory;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StoreResolverTest {

    @Test
    void shouldMapAdminCodeToStoreZeroWithoutLookup() {
        StoreDirectory directory = mock(StoreDirectory.class);
        StoreResolver resolver = new StoreResolver(directory, "admin");

        assertEquals(Optional.of(0L), resolver.resolve("ADMIN"));
        verify(directory, never()).findStoreId("admin");
    }

    @Test
    void shouldCacheHitsAndMisses() {
        StoreDirectory directory = mock(StoreDirectory.class);
        when(directory.findStoreId("de")).thenReturn(Optional.of(2L));
        when(directory.findStoreId("fr")).thenReturn(Optional.empty());
        StoreResolver resolver = new StoreResolver(directory, "admin");

        assertEquals(Optional.of(2L), resolver.resolve("de"));
        assertEquals(Optional.of(2L), resolver.resolve(" DE "));
        assertEquals(Optional.empty(), resolver.resolve("fr"));
        assertEquals(Optional.empty(), resolver.resolve("fr"));

        verify(directory, times(1)).findStoreId("de");
        verify(directory, times(1)).findStoreId("fr");
    }
}
