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

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

import java.io.Serializable;

/**
 * Bounding box over the raster grid in (x0, y0, x1, y1) order. Columns [x0, x1) and rows [y0, y1), i.e. the end
 * coordinates are exclusive.
 */
public final class Box implements Serializable {
    public final int x0, y0, x1, y1;

    public Box(int x0, int y0, int x1, int y1) {
        if (x0 < 0 || y0 < 0 || x1 <= x0 || y1 <= y0) {
            throw new IllegalArgumentException("invalid box " + format(x0, y0, x1, y1));
        }
        this.x0 = x0;
        this.y0 = y0;
        this.x1 = x1;
        this.y1 = y1;
    }

    /** Box covering a whole length x width raster */
    public static Box full(int length, int width) {
        return new Box(0, 0, width, length);
    }

    public int getWidth() {
        return x1 - x0;
    }

    public int getLength() {
        return y1 - y0;
    }

    public long getNumPixels() {
        return (long) getWidth() * getLength();
    }

    /** Does this box lie inside a length x width raster? */
    public boolean fitsIn(int length, int width) {
        return x1 <= width && y1 <= length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Box)) return false;
        Box that = (Box) o;
        return new EqualsBuilder()
                .append(x0, that.x0).append(y0, that.y0)
                .append(x1, that.x1).append(y1, that.y1)
                .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder().append(x0).append(y0).append(x1).append(y1).toHashCode();
    }

    @Override
    public String toString() {
        return format(x0, y0, x1, y1);
    }

    private static String format(int x0, int y0, int x1, int y1) {
        return "(" + x0 + ", " + y0 + ", " + x1 + ", " + y1 + ")";
    }
}
