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
package com.samsung.sra.closurephase.tools;

import com.moandjiezana.toml.Toml;
import com.samsung.sra.closurephase.BiasOptions;

import java.io.File;

/**
 * TOML configuration of a bias-correction run. Every key is optional; missing keys take the {@link BiasOptions}
 * defaults. Raises IllegalArgumentException on a missing file or out-of-range values, but otherwise expects the file
 * is a legal config (e.g. floating point keys written with a decimal point).
 */
public class Configuration {
    private final Toml toml;

    public Configuration(File file) {
        if (!file.isFile()) throw new IllegalArgumentException("invalid or non-existent config file " + file);
        toml = new Toml().read(file);
    }

    /** All defaults */
    public Configuration() {
        toml = new Toml();
    }

    /** Connection level assumed free of bias */
    public int getReferenceLevel() {
        return toml.getLong("reference-level", 20L).intValue();
    }

    /** Maximum connection level of the time-series network */
    public int getBandwidth() {
        return toml.getLong("bandwidth", 10L).intValue();
    }

    /** Memory budget in GB for block-wise processing */
    public double getMaxMemory() {
        return toml.getDouble("max-memory", 4.0);
    }

    public String getOutdir() {
        return toml.getString("outdir", "./");
    }

    /** Recompute missing closure phase artifacts */
    public boolean getUpdate() {
        return toml.getBoolean("update", true);
    }

    public double getNumSigma() {
        return toml.getDouble("mask.num-sigma", 3.0);
    }

    public double getAmplitudeThreshold() {
        return toml.getDouble("mask.amplitude-threshold", 0.3);
    }

    public int getKernelSize() {
        return toml.getLong("filter.kernel-size", 5L).intValue();
    }

    public double getKernelSigma() {
        return toml.getDouble("filter.sigma", 1.0);
    }

    public double getMinCoherence() {
        return toml.getDouble("unwrap.min-coherence", 0.0);
    }

    /** 0 = serial */
    public int getNumWorkers() {
        return toml.getLong("parallel.num-workers", 0L).intValue();
    }

    public BiasOptions toBiasOptions() {
        return new BiasOptions()
                .setReferenceLevel(getReferenceLevel())
                .setBandwidth(getBandwidth())
                .setMaxMemory(getMaxMemory())
                .setOutdir(getOutdir())
                .setUpdate(getUpdate())
                .setNumSigma(getNumSigma())
                .setAmplitudeThreshold(getAmplitudeThreshold())
                .setKernelSize(getKernelSize())
                .setKernelSigma(getKernelSigma())
                .setMinCoherence(getMinCoherence())
                .setNumWorkers(getNumWorkers());
    }
}
