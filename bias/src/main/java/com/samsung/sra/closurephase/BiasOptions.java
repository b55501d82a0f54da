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
package com.samsung.sra.closurephase;

import java.io.Serializable;

/** Resolved settings of one bias-correction run */
public class BiasOptions implements Serializable {
    private int referenceLevel = 20;
    private int bandwidth = 10;
    /** GB */
    private double maxMemory = 4.0;
    /** null keeps every output in memory */
    private String outdir = "./";
    private boolean update = true;
    private double numSigma = 3.0;
    private double amplitudeThreshold = 0.3;
    private int kernelSize = 5;
    private double kernelSigma = 1.0;
    private double minCoherence = 0.0;
    /** 0 = serial */
    private int numWorkers = 0;

    public BiasOptions setReferenceLevel(int referenceLevel) {
        if (referenceLevel < 1) {
            throw new IllegalArgumentException("reference connection level must be >= 1, got " + referenceLevel);
        }
        this.referenceLevel = referenceLevel;
        return this;
    }

    public int getReferenceLevel() {
        return referenceLevel;
    }

    public BiasOptions setBandwidth(int bandwidth) {
        if (bandwidth < 1) {
            throw new IllegalArgumentException("bandwidth must be >= 1, got " + bandwidth);
        }
        this.bandwidth = bandwidth;
        return this;
    }

    public int getBandwidth() {
        return bandwidth;
    }

    public BiasOptions setMaxMemory(double maxMemory) {
        if (!(maxMemory > 0)) {
            throw new IllegalArgumentException("memory budget must be positive, got " + maxMemory);
        }
        this.maxMemory = maxMemory;
        return this;
    }

    public double getMaxMemory() {
        return maxMemory;
    }

    public BiasOptions setOutdir(String outdir) {
        this.outdir = outdir;
        return this;
    }

    public String getOutdir() {
        return outdir;
    }

    public BiasOptions setUpdate(boolean update) {
        this.update = update;
        return this;
    }

    public boolean getUpdate() {
        return update;
    }

    public BiasOptions setNumSigma(double numSigma) {
        if (!(numSigma > 0)) {
            throw new IllegalArgumentException("number of sigmas must be positive, got " + numSigma);
        }
        this.numSigma = numSigma;
        return this;
    }

    public double getNumSigma() {
        return numSigma;
    }

    public BiasOptions setAmplitudeThreshold(double amplitudeThreshold) {
        if (!(amplitudeThreshold >= 0 && amplitudeThreshold <= 1)) {
            throw new IllegalArgumentException("amplitude threshold must be in [0, 1], got " + amplitudeThreshold);
        }
        this.amplitudeThreshold = amplitudeThreshold;
        return this;
    }

    public double getAmplitudeThreshold() {
        return amplitudeThreshold;
    }

    public BiasOptions setKernelSize(int kernelSize) {
        if (kernelSize < 1 || kernelSize % 2 == 0) {
            throw new IllegalArgumentException("kernel size must be a positive odd number, got " + kernelSize);
        }
        this.kernelSize = kernelSize;
        return this;
    }

    public int getKernelSize() {
        return kernelSize;
    }

    public BiasOptions setKernelSigma(double kernelSigma) {
        if (!(kernelSigma > 0)) {
            throw new IllegalArgumentException("kernel sigma must be positive, got " + kernelSigma);
        }
        this.kernelSigma = kernelSigma;
        return this;
    }

    public double getKernelSigma() {
        return kernelSigma;
    }

    public BiasOptions setMinCoherence(double minCoherence) {
        if (!(minCoherence >= 0 && minCoherence <= 1)) {
            throw new IllegalArgumentException("minimum coherence must be in [0, 1], got " + minCoherence);
        }
        this.minCoherence = minCoherence;
        return this;
    }

    public double getMinCoherence() {
        return minCoherence;
    }

    public BiasOptions setNumWorkers(int numWorkers) {
        if (numWorkers < 0) {
            throw new IllegalArgumentException("number of workers must be >= 0, got " + numWorkers);
        }
        this.numWorkers = numWorkers;
        return this;
    }

    public int getNumWorkers() {
        return numWorkers;
    }

    @Override
    public String toString() {
        return String.format("referenceLevel=%d, bandwidth=%d, maxMemory=%s GB, outdir=%s, update=%s, numSigma=%s,"
                        + " amplitudeThreshold=%s, kernel=%dx%d (sigma %s), minCoherence=%s, numWorkers=%d",
                referenceLevel, bandwidth, maxMemory, outdir, update, numSigma, amplitudeThreshold,
                kernelSize, kernelSize, kernelSigma, minCoherence, numWorkers);
    }
}
