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
package com.samsung.sra.closurephase.unwrap;

import com.samsung.sra.closurephase.closure.ComplexRaster;

/**
 * Convolution with a normalized size x size Gaussian kernel, zero padded, same output size. Defaults to the 5 x 5,
 * sigma 1 kernel used for closure phase interferograms.
 */
public class GaussianKernelFilter implements PhaseFilter {
    private final double[][] kernel;

    public GaussianKernelFilter() {
        this(5, 1.0);
    }

    public GaussianKernelFilter(int size, double sigma) {
        if (size < 1 || size % 2 == 0) {
            throw new IllegalArgumentException("kernel size must be a positive odd number, got " + size);
        }
        if (!(sigma > 0)) {
            throw new IllegalArgumentException("kernel sigma must be positive, got " + sigma);
        }
        kernel = new double[size][size];
        int half = size / 2;
        double total = 0;
        for (int i = 0; i < size; ++i) {
            for (int j = 0; j < size; ++j) {
                int dy = i - half, dx = j - half;
                kernel[i][j] = Math.exp(-(dy * dy + dx * dx) / (2 * sigma * sigma));
                total += kernel[i][j];
            }
        }
        for (double[] row : kernel) {
            for (int j = 0; j < size; ++j) {
                row[j] /= total;
            }
        }
    }

    double[][] getKernel() {
        return kernel;
    }

    @Override
    public ComplexRaster filter(ComplexRaster in) {
        int length = in.getLength(), width = in.getWidth(), half = kernel.length / 2;
        ComplexRaster out = new ComplexRaster(length, width);
        for (int y = 0; y < length; ++y) {
            for (int x = 0; x < width; ++x) {
                double re = 0, im = 0;
                for (int i = 0; i < kernel.length; ++i) {
                    int yy = y + i - half;
                    if (yy < 0 || yy >= length) continue;
                    for (int j = 0; j < kernel.length; ++j) {
                        int xx = x + j - half;
                        if (xx < 0 || xx >= width) continue;
                        re += kernel[i][j] * in.getReal(yy, xx);
                        im += kernel[i][j] * in.getImaginary(yy, xx);
                    }
                }
                out.set(y, x, re, im);
            }
        }
        return out;
    }
}
