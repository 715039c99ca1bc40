package strongbox.core.service.secret;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import strongbox.core.config.SecretsConfig;
import strongbox.core.port.in.SecretObsolescence;

@ExtendWith(MockitoExtension.class)
@DisplayName("UserSecretPruneJob")
class UserSecretPruneJobTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    @Mock
    private SecretObsolescence obsolescence;

    @Mock
    private SecretsConfig config;

    @Mock
    private SecretsConfig.Prune prune;

    private UserSecretPruneJob job;

    @BeforeEach
    void setUp() {
        lenient().when(config.prune()).thenReturn(prune);
        job = new UserSecretPruneJob(obsolescence, config);
    }

    @Test
    @DisplayName("should do nothing when disabled")
    void shouldSkipWhenDisabled() {
        when(prune.enabled()).thenReturn(false);

        job.prune().await().atMost(TIMEOUT);

        verify(obsolescence, never()).deleteObsoleteUserSecretRevisions();
    }

    @Test
    @DisplayName("should delete obsolete revisions when enabled")
    void shouldPruneWhenEnabled() {
        when(prune.enabled()).thenReturn(true);
        when(obsolescence.deleteObsoleteUserSecretRevisions())
                .thenReturn(Uni.createFrom().item(List.of("r1", "r2")));

        assertDoesNotThrow(() -> job.prune().await().atMost(TIMEOUT));

        verify(obsolescence).deleteObsoleteUserSecretRevisions();
    }

    @Test
    @DisplayName("should propagate store failures")
    void shouldPropagateFailure() {
        when(prune.enabled()).thenReturn(true);
        when(obsolescence.deleteObsoleteUserSecretRevisions())
                .thenReturn(Uni.createFrom().failure(new IllegalStateException("store unavailable")));

        assertThrows(IllegalStateException.class, () -> job.prune().await().atMost(TIMEOUT));
    }

    @Test
    @DisplayName("should schedule from the prune interval property")
    void shouldScheduleFromPruneInterval() throws NoSuchMethodException {
        final var scheduled = UserSecretPruneJob.class.getMethod("prune").getAnnotation(Scheduled.class);

        assertEquals("${strongbox.secrets.prune.interval:1h}", scheduled.every());
        assertEquals(Scheduled.ConcurrentExecution.SKIP, scheduled.concurrentExecution());
    }
}
