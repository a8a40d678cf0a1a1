package com.stacker.config;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Configuration for bulk (re)population of the Stacker indexes.
 */
@Data
@NoArgsConstructor
public class LoaderConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Rows fetched from the projector and sent per bulk request. */
    private int chunkSize = 5000;
}
