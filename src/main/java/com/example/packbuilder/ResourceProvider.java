package com.example.packbuilder;

import com.example.packbuilder.resource.ResourceSet;

import java.io.IOException;

@FunctionalInterface
public interface ResourceProvider {
    /**
     * Produces the resource set of the next build. Payloads are not computed here.
     */
    ResourceSet build() throws IOException;
}
