package com.riansoft.delivery_dispatch.service;

import com.riansoft.delivery_dispatch.exception.DistanceMatrixException;
import com.riansoft.delivery_dispatch.model.DistanceMatrix;

import java.util.List;

public interface DistanceMatrixProvider {

    /**
     * @param coordinates "longitude,latitude" strings, depot first
     * @return full pairwise matrix in the same order
     * @throws DistanceMatrixException when the provider fails or answers with an unusable matrix
     */
    DistanceMatrix fetchMatrix(List<String> coordinates);
}
