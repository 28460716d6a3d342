package io.cwrelay.core.provider;

import io.cwrelay.core.model.MetricDescriptor;

import java.util.List;

/**
 * One page of a descriptor listing.
 *
 * @param nextToken continuation token, null on the last page
 */
public record DescriptorPage(List<MetricDescriptor> descriptors, String nextToken) {

    public DescriptorPage {
        descriptors = descriptors == null ? List.of() : List.copyOf(descriptors);
    }
}
