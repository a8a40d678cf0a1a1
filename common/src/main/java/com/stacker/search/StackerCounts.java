package com.stacker.search;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Total documents a company has in each index, regardless of filters.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StackerCounts implements Serializable {

    private static final long serialVersionUID = 1L;

    private long prospects;
    private long properties;
}
