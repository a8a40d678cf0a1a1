package com.stacker.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.List;

/**
 * The tags currently assigned to one property and how many of them are distress indicators.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PropertyTags implements Serializable {

    private static final long serialVersionUID = 1L;

    private int propertyId;
    private List<Integer> tagIds;
    private int distressCount;
}
