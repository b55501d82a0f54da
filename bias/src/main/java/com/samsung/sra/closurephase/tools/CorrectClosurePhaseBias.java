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

import com.samsung.sra.arraystore.DatasetException;
import com.samsung.sra.arraystore.storage.BackingStoreException;
import com.samsung.sra.closurephase.BiasOptions;
import com.samsung.sra.closurephase.ClosurePhaseBias;
import com.samsung.sra.closurephase.ClosurePhaseException;
import com.samsung.sra.closurephase.stack.InterferogramStack;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.helper.HelpScreenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.PrintWriter;

/**
 * Estimates closure phase bias of an interferogram stack. Exit code 0 on success, 1 if processing failed, 2 on bad
 * arguments.
 */
public class CorrectClosurePhaseBias {
    private static final Logger logger = LoggerFactory.getLogger(CorrectClosurePhaseBias.class);

    static ArgumentParser buildParser() {
        ArgumentParser parser = ArgumentParsers.newFor("CorrectClosurePhaseBias").build().
                description("estimate closure phase bias of an interferogram stack: flag bias-susceptible pixels (mask)," +
                        " estimate decay ratios and an approximate bias time series (quick_estimate), or invert the" +
                        " exact bias time series (estimate)").
                defaultHelp(true);
        parser.addArgument("-i", "--stack").dest("stack").required(true).help("interferogram stack directory");
        parser.addArgument("-a", "--action").dest("action").choices("mask", "quick_estimate", "estimate").
                setDefault("mask").help("action to run");
        parser.addArgument("--nl").dest("nl").type(Integer.class).
                help("connection level assumed bias-free (config: reference-level)");
        parser.addArgument("--bw").dest("bw").type(Integer.class).
                help("bandwidth of the time-series network (config: bandwidth)");
        parser.addArgument("--num-sigma").dest("num_sigma").type(Double.class).
                help("phase threshold of the mask, in standard deviations (config: mask.num-sigma)");
        parser.addArgument("--eps").dest("eps").type(Double.class).
                help("amplitude threshold of the mask (config: mask.amplitude-threshold)");
        parser.addArgument("--max-memory").dest("max_memory").type(Double.class).
                help("memory budget in GB (config: max-memory)");
        parser.addArgument("--num-workers").dest("num_workers").type(Integer.class).
                help("number of parallel workers for estimate, 0 = serial (config: parallel.num-workers)");
        parser.addArgument("--noupdate").dest("noupdate").action(Arguments.storeTrue()).
                help("do not compute missing closure phase artifacts; fail instead");
        parser.addArgument("-o", "--outdir").dest("outdir").help("output directory (config: outdir)");
        parser.addArgument("--config").dest("config").help("TOML configuration file");
        return parser;
    }

    /** Options from the config file (if any), overridden by the command-line flags that were given */
    static BiasOptions toBiasOptions(Namespace parsed) {
        String configFile = parsed.getString("config");
        BiasOptions options = (configFile != null ? new Configuration(new File(configFile)) : new Configuration())
                .toBiasOptions();
        if (parsed.get("nl") != null) options.setReferenceLevel(parsed.getInt("nl"));
        if (parsed.get("bw") != null) options.setBandwidth(parsed.getInt("bw"));
        if (parsed.get("num_sigma") != null) options.setNumSigma(parsed.getDouble("num_sigma"));
        if (parsed.get("eps") != null) options.setAmplitudeThreshold(parsed.getDouble("eps"));
        if (parsed.get("max_memory") != null) options.setMaxMemory(parsed.getDouble("max_memory"));
        if (parsed.get("num_workers") != null) options.setNumWorkers(parsed.getInt("num_workers"));
        if (parsed.getBoolean("noupdate")) options.setUpdate(false);
        if (parsed.get("outdir") != null) options.setOutdir(parsed.getString("outdir"));
        return options;
    }

    static int run(String[] args) {
        ArgumentParser parser = buildParser();
        String stackDirectory;
        ClosurePhaseBias.Action action;
        BiasOptions options;
        try {
            Namespace parsed = parser.parseArgs(args);
            stackDirectory = parsed.getString("stack");
            action = ClosurePhaseBias.Action.fromName(parsed.getString("action"));
            options = toBiasOptions(parsed);
        } catch (HelpScreenException e) {
            return 0;
        } catch (ArgumentParserException | IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            parser.printHelp(new PrintWriter(System.err, true));
            return 2;
        }

        try (InterferogramStack stack = InterferogramStack.open(stackDirectory);
             ClosurePhaseBias bias = new ClosurePhaseBias(stack, options)) {
            bias.run(action);
        } catch (ClosurePhaseException e) {
            logger.error("action {} failed{}{}: {}", action,
                    e.getConnectionLevel() >= 0 ? " at connection level " + e.getConnectionLevel() : "",
                    e.getBox() != null ? " in box " + e.getBox() : "",
                    e.getMessage(), e);
            return 1;
        } catch (BackingStoreException | DatasetException e) {
            logger.error("action {} failed: {}", action, e.getMessage(), e);
            return 1;
        }
        return 0;
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }
}
