package com.autods.core.training;

import weka.core.Attribute;
import weka.core.SelectedTag;
import weka.filters.Filter;
import weka.filters.MultiFilter;
import weka.filters.unsupervised.attribute.RemoveType;
import weka.filters.unsupervised.attribute.ReplaceMissingValues;
import weka.filters.unsupervised.attribute.Standardize;

/**
 * Feature preprocessing applied inside every candidate: free-text columns are
 * dropped, missing values imputed (mean for numeric, mode for nominal) and
 * numeric columns standardised. The filter is fitted on the training split only.
 */
public final class Preprocessing {

    private Preprocessing() {}

    public static Filter newFilter() {
        RemoveType dropStrings = new RemoveType();
        dropStrings.setAttributeType(new SelectedTag(Attribute.STRING, RemoveType.TAGS_ATTRIBUTETYPE));

        MultiFilter pipeline = new MultiFilter();
        pipeline.setFilters(new Filter[] {dropStrings, new ReplaceMissingValues(), new Standardize()});
        return pipeline;
    }
}
