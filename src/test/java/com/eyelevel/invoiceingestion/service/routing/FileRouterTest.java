package com.eyelevel.invoiceingestion.service.routing;

import com.eyelevel.invoiceingestion.config.IngestionProperties;
import com.eyelevel.invoiceingestion.service.source.LocalSourceConnector;
import com.eyelevel.invoiceingestion.service.source.SourceLayout;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class FileRouterTest {

    @TempDir
    Path root;

    private final FileRouter router = new FileRouter();
    private final LocalSourceConnector connector = new LocalSourceConnector();
    private SourceLayout layout;

    @BeforeEach
    void setUp() throws IOException {
        layout = SourceLayout.of(root.toString().replace('\\', '/'), null, new IngestionProperties.FolderStructure());
        Files.createDirectories(Path.of(layout.unprocessed()));
    }

    @Test
    void movesProcessedFileIntoDatedFolder() throws IOException {
        final String source = drop("inv-1.pdf", "one");

        final String routed = router.route(connector, layout, source, TerminalState.PROCESSED, null);

        assertThat(routed).isEqualTo(layout.processed() + "/" + LocalDate.now() + "/inv-1.pdf");
        assertThat(Path.of(routed)).hasContent("one");
        assertThat(Path.of(source)).doesNotExist();
    }

    @Test
    void neverOverwritesAnExistingFile() throws IOException {
        router.route(connector, layout, drop("inv-2.pdf", "first"), TerminalState.DUPLICATE, null);

        final String second = router.route(connector, layout, drop("inv-2.pdf", "second"), TerminalState.DUPLICATE,
                                           null);

        assertThat(second).startsWith(layout.duplicates() + "/" + LocalDate.now() + "/inv-2-")
                          .endsWith(".pdf");
        assertThat(Path.of(second)).hasContent("second");
        assertThat(Path.of(layout.duplicates(), LocalDate.now().toString(), "inv-2.pdf")).hasContent("first");
    }

    @Test
    void failedFileGetsErrorSidecar() throws IOException {
        final String routed = router.route(connector, layout, drop("bad.pdf", "x"), TerminalState.FAILED,
                                           "PDF is encrypted");

        assertThat(Path.of(routed + ".error.txt")).content().contains("Error: PDF is encrypted");
    }

    @Test
    void suffixGoesBeforeExtension() {
        assertThat(FileRouter.withSuffix("a.b.pdf", 5)).isEqualTo("a.b-5.pdf");
        assertThat(FileRouter.withSuffix("README", 5)).isEqualTo("README-5");
        assertThat(FileRouter.withSuffix(".hidden", 5)).isEqualTo(".hidden-5");
    }

    private String drop(final String name, final String content) throws IOException {
        final Path file = Path.of(layout.unprocessed(), name);
        Files.writeString(file, content);
        return file.toString().replace('\\', '/');
    }
}
