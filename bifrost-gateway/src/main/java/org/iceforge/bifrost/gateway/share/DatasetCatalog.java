package org.iceforge.bifrost.gateway.share;

import java.util.Optional;

/** Looks up the datasets that dataset links point at. */
public interface DatasetCatalog {

    /**
     * @param url public download location, or null when the dataset is only described
     */
    record Dataset(String id, String name, String description, String format, String url) {
    }

    Optional<Dataset> find(String datasetId);
}
