package ch.so.arp.lograg.ingest;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.function.BooleanSupplier;

import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

class IngestionStartupRunnerTest {

    @Test
    void ingestsConfiguredCollection() {
        IngestionPipeline pipeline = mock(IngestionPipeline.class);
        when(pipeline.ingest(eq("aks_logs"), any(BooleanSupplier.class)))
                .thenReturn(new IngestionReport("aks_logs", List.of(), false));

        new IngestionStartupRunner(pipeline, "aks_logs").run(new DefaultApplicationArguments());

        verify(pipeline).ingest(eq("aks_logs"), any(BooleanSupplier.class));
    }

    @Test
    void propagatesFatalFailures() {
        IngestionPipeline pipeline = mock(IngestionPipeline.class);
        when(pipeline.ingest(eq("aks_logs"), any(BooleanSupplier.class)))
                .thenThrow(new CollectionSetupException("Unable to create collection 'aks_logs'",
                        new IllegalStateException("connection refused")));

        assertThatThrownBy(() -> new IngestionStartupRunner(pipeline, "aks_logs")
                .run(new DefaultApplicationArguments()))
                .isInstanceOf(CollectionSetupException.class);
    }
}
