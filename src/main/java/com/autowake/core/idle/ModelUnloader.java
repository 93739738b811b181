package com.autowake.core.idle;

/**
 * Unload capability of the inference runtime.
 */
@FunctionalInterface
public interface ModelUnloader {

    /**
     * @return true if the runtime acknowledged the unload
     */
    boolean unload(String modelName);
}
