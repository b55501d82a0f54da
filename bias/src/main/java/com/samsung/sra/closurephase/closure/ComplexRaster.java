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
package com.samsung.sra.closurephase.closure;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.complex.ComplexUtils;

/** A length x width raster of complex values, stored as separate real and imaginary planes */
public class ComplexRaster {
    private final double[][] re, im;

    public ComplexRaster(int length, int width) {
        re = new double[length][width];
        im = new double[length][width];
    }

    /** Unit phasors exp(i * phase) */
    public static ComplexRaster fromPhase(float[][] phase) {
        ComplexRaster ret = new ComplexRaster(phase.length, phase.length == 0 ? 0 : phase[0].length);
        for (int y = 0; y < ret.getLength(); ++y) {
            for (int x = 0; x < ret.getWidth(); ++x) {
                ret.add(y, x, phase[y][x]);
            }
        }
        return ret;
    }

    /**
     * Wrap a phase into (-pi, pi] through the complex exponential, which stays correct for any accumulated magnitude.
     */
    public static double wrap(double phase) {
        double wrapped = ComplexUtils.polar2Complex(1, phase).getArgument();
        return wrapped == -Math.PI ? Math.PI : wrapped;
    }

    /** {@link #wrap} rounded to float; the float nearest to -pi also maps to the float nearest to pi */
    public static float wrapToFloat(double phase) {
        return toFloatAngle(wrap(phase));
    }

    private static float toFloatAngle(double angle) {
        float ret = (float) angle;
        return ret == -(float) Math.PI ? (float) Math.PI : ret;
    }

    public int getLength() {
        return re.length;
    }

    public int getWidth() {
        return re.length == 0 ? 0 : re[0].length;
    }

    public Complex get(int y, int x) {
        return new Complex(re[y][x], im[y][x]);
    }

    public double getReal(int y, int x) {
        return re[y][x];
    }

    public double getImaginary(int y, int x) {
        return im[y][x];
    }

    public void set(int y, int x, double real, double imaginary) {
        re[y][x] = real;
        im[y][x] = imaginary;
    }

    /** Accumulate exp(i * phase) at (y, x) */
    public void add(int y, int x, double phase) {
        re[y][x] += Math.cos(phase);
        im[y][x] += Math.sin(phase);
    }

    public void divide(double divisor) {
        for (int y = 0; y < re.length; ++y) {
            for (int x = 0; x < re[y].length; ++x) {
                re[y][x] /= divisor;
                im[y][x] /= divisor;
            }
        }
    }

    /** Angle in (-pi, pi] */
    public float[][] getPhase() {
        float[][] phase = new float[getLength()][getWidth()];
        for (int y = 0; y < re.length; ++y) {
            for (int x = 0; x < re[y].length; ++x) {
                phase[y][x] = toFloatAngle(Math.atan2(im[y][x], re[y][x]));
            }
        }
        return phase;
    }

    public float[][] getAmplitude() {
        float[][] amplitude = new float[getLength()][getWidth()];
        for (int y = 0; y < re.length; ++y) {
            for (int x = 0; x < re[y].length; ++x) {
                amplitude[y][x] = (float) Math.hypot(re[y][x], im[y][x]);
            }
        }
        return amplitude;
    }

    /** Copy this raster into dst at row offset y0, column offset x0 */
    public void copyInto(ComplexRaster dst, int y0, int x0) {
        for (int y = 0; y < re.length; ++y) {
            System.arraycopy(re[y], 0, dst.re[y0 + y], x0, re[y].length);
            System.arraycopy(im[y], 0, dst.im[y0 + y], x0, im[y].length);
        }
    }
}
