package org.iceforge.bifrost.gateway.share;

import org.iceforge.bifrost.gateway.config.GatewayProperties;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/** Datasets declared under {@code bifrost.gateway.datasets}, keyed by dataset id. */
@Component
public class ConfiguredDatasetCatalog implements DatasetCatalog {

    private final Map<String, GatewayProperties.Dataset> datasets;

    public ConfiguredDatasetCatalog(GatewayProperties props) {
        this.datasets = props.datasets();
    }

    @Override
    public Optional<Dataset> find(String datasetId) {
        GatewayProperties.Dataset d = datasets.get(datasetId);
        if (d == null) {
            return Optional.empty();
        }
        String name = d.name() == null ? datasetId : d.name();
        return Optional.of(new Dataset(datasetId, name, d.description(), d.format(), d.location()));
    }
}
