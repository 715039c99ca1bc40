package strongbox.core.service.backend;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import strongbox.core.model.backend.SecretBackend;
import strongbox.core.port.out.SecretBackendAdapter;
import strongbox.spi.SecretBackendProvider;
import strongbox.spi.StorageProviderException;

@ExtendWith(MockitoExtension.class)
@DisplayName("BackendRegistry")
class BackendRegistryTest {

    @Mock
    private SecretBackendProvider vault;

    @Mock
    private SecretBackendAdapter adapter;

    @Mock
    private SecretBackendAdapter reopened;

    private BackendRegistry registry;
    private SecretBackend backend;

    @BeforeEach
    void setUp() {
        when(vault.type()).thenReturn("vault");
        registry = new BackendRegistry(List.of(vault));
        backend = new SecretBackend("b1", "myvault", "vault", null, Map.of());
    }

    @Test
    @DisplayName("should open and cache an adapter per backend")
    void shouldOpenAndCacheAdapter() {
        when(vault.open(any())).thenReturn(adapter);

        assertSame(adapter, registry.adapterFor(backend));
        assertSame(adapter, registry.adapterFor(backend));
        verify(vault, times(1)).open(backend);
    }

    @Test
    @DisplayName("should reopen an evicted backend")
    void shouldReopenEvictedBackend() {
        when(vault.open(any())).thenReturn(adapter, reopened);

        final var first = registry.adapterFor(backend);
        registry.evict("b1");

        assertNotSame(first, registry.adapterFor(backend));
    }

    @Test
    @DisplayName("should fail for a type without provider")
    void shouldFailForUnknownType() {
        final var kubernetes = new SecretBackend("b2", "k8s", "kubernetes", null, Map.of());

        assertTrue(registry.supports("vault"));
        assertFalse(registry.supports("kubernetes"));
        assertThrows(StorageProviderException.class, () -> registry.adapterFor(kubernetes));
    }
}
