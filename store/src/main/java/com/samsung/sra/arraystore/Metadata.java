/*
* Copyright 2016 Samsung Research America. All rights reserved.
*
* Licensed under the Apache License, Version 2.0 (the "License");
* you may not use this file except in compliance with the License.
* You may obtain a copy of the License at
*
*     http://www.apache.org/licenses/LICENSE-2.0
*
* Unless required by applicable law or agreed to in writing, software
* distributed under the License is distributed on an "AS IS" BASIS,
* WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
* See the License for the specific language governing permissions and
* limitations under the License.
*/
package com.samsung.sra.arraystore;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable container-level metadata. The handful of keys the processing code actually consumes are named fields;
 * anything else travels in the free-form attribute map. Use the with* methods to derive modified copies.
 */
public final class Metadata implements Serializable {
    private final int length, width;
    /** Radar wavelength in metres */
    private final double wavelength;
    /** Reference pixel, -1 if unset */
    private final int refY, refX;
    private final String fileType;
    private final Map<String, String> attributes;

    public Metadata(int length, int width, double wavelength, int refY, int refX, String fileType) {
        this(length, width, wavelength, refY, refX, fileType, Collections.emptyMap());
    }

    private Metadata(int length, int width, double wavelength, int refY, int refX, String fileType,
                     Map<String, String> attributes) {
        if (length <= 0 || width <= 0) {
            throw new IllegalArgumentException("invalid raster size " + length + " x " + width);
        }
        if (refY >= length || refX >= width) {
            throw new IllegalArgumentException("reference pixel (" + refY + ", " + refX + ") outside raster");
        }
        this.length = length;
        this.width = width;
        this.wavelength = wavelength;
        this.refY = refY;
        this.refX = refX;
        this.fileType = fileType;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public int getLength() {
        return length;
    }

    public int getWidth() {
        return width;
    }

    public double getWavelength() {
        return wavelength;
    }

    public int getRefY() {
        return refY;
    }

    public int getRefX() {
        return refX;
    }

    public boolean hasReferencePixel() {
        return refY >= 0 && refX >= 0;
    }

    public String getFileType() {
        return fileType;
    }

    public String getAttribute(String key) {
        return attributes.get(key);
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public Metadata withFileType(String fileType) {
        return new Metadata(length, width, wavelength, refY, refX, fileType, attributes);
    }

    public Metadata withReferencePixel(int refY, int refX) {
        return new Metadata(length, width, wavelength, refY, refX, fileType, attributes);
    }

    public Metadata withAttribute(String key, String value) {
        Map<String, String> copy = new LinkedHashMap<>(attributes);
        copy.put(key, value);
        return new Metadata(length, width, wavelength, refY, refX, fileType, copy);
    }

    @Override
    public String toString() {
        return String.format("<%s: %d x %d, wavelength %s m, reference pixel (%d, %d), %s>",
                fileType, length, width, wavelength, refY, refX, attributes);
    }
}
