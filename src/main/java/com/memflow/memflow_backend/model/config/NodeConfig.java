package com.memflow.memflow_backend.model.config;

/**
 * Typed configuration of a node, bound from the node's JSON config when the graph is built.
 */
public interface NodeConfig {

    /** Throws {@link com.memflow.memflow_backend.exception.ConfigurationException} when the config is unusable. */
    void validate();
}
