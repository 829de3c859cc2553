package com.eyelevel.invoiceingestion.service.source;

import com.eyelevel.invoiceingestion.exception.IngestionException;
import com.eyelevel.invoiceingestion.model.SourceKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * A factory for retrieving the appropriate {@link SourceConnector} for a given source kind.
 * It discovers all available connector beans and selects the first one that supports the kind.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SourceConnectorFactory {

    private final List<SourceConnector> connectors;

    public SourceConnector getConnector(final SourceKind kind) {
        return connectors.stream()
                         .filter(connector -> connector.supports(kind))
                         .findFirst()
                         .orElseThrow(() -> {
                             log.error("No source connector registered for kind '{}'.", kind);
                             return new IngestionException("No source connector available for " + kind);
                         });
    }
}
