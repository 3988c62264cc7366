package com.modelrouter.common.scoring;

import com.modelrouter.common.model.QueryFeatures;

import java.util.List;

/**
 * Strategy that turns per-query features into a difficulty vector aligned with the
 * checkpoint's dimensions.
 *
 * <p>The scoring engine only relies on the returned array having one entry per dimension;
 * the numeric form is free to change with the checkpoint it was trained alongside.
 * Implementations must be pure and thread-safe.
 */
public interface DifficultyMapping {

    /**
     * @param features   extracted query features
     * @param dimensions the checkpoint's ordered dimension names
     * @return difficulty vector, {@code dimensions.size()} long
     */
    double[] difficulty(QueryFeatures features, List<String> dimensions);
}
