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

import com.samsung.sra.arraystore.Box;
import com.samsung.sra.arraystore.DatasetException;
import com.samsung.sra.arraystore.storage.BackingStoreException;
import com.samsung.sra.closurephase.stack.InterferogramStack;
import com.samsung.sra.closurephase.stack.SyntheticStack;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.Argument;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.ArgumentType;
import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.helper.HelpScreenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;

/** Writes a deterministic synthetic interferogram stack, optionally with bias injected over a patch */
public class GenerateSyntheticStack {
    private static final Logger logger = LoggerFactory.getLogger(GenerateSyntheticStack.class);

    private static final ArgumentType<double[]> CommaSeparatedDoubles = (ArgumentParser argParser, Argument arg, String value) -> {
        String[] tokens = value.split(",");
        double[] ret = new double[tokens.length];
        try {
            for (int i = 0; i < tokens.length; ++i) {
                ret[i] = Double.parseDouble(tokens[i].trim());
            }
        } catch (NumberFormatException e) {
            throw new ArgumentParserException("invalid number list " + value, e, argParser);
        }
        return ret;
    };

    static ArgumentParser buildParser() {
        ArgumentParser parser = ArgumentParsers.newFor("GenerateSyntheticStack").build().
                description("write a synthetic interferogram stack with a bandwidth-limited network plus longer pairs").
                defaultHelp(true);
        parser.addArgument("directory").help("output stack directory");
        parser.addArgument("--start-date").dest("start_date").setDefault("20200101").help("first acquisition, YYYYMMDD");
        parser.addArgument("-N", "--num-dates").dest("num_dates").type(Integer.class).setDefault(5).
                help("number of acquisitions");
        parser.addArgument("--spacing").dest("spacing").type(Integer.class).setDefault(12).
                help("days between acquisitions");
        parser.addArgument("--bw").dest("bw").type(Integer.class).setDefault(2).help("bandwidth of the active network");
        parser.addArgument("--max-connection").dest("max_connection").type(Integer.class).setDefault(4).
                help("largest connection level formed");
        parser.addArgument("--length").dest("length").type(Integer.class).setDefault(12).help("raster rows");
        parser.addArgument("--width").dest("width").type(Integer.class).setDefault(12).help("raster columns");
        parser.addArgument("--wavelength").dest("wavelength").type(Double.class).setDefault(0.05546576).
                help("radar wavelength in metres");
        parser.addArgument("--deformation").dest("deformation").type(Double.class).setDefault(0.25).
                help("deformation phase per acquisition step, radians");
        parser.addArgument("--bias").dest("bias").type(CommaSeparatedDoubles).
                help("bias in radians per connection level, starting at level 0, e.g. 0,0.2,0.2");
        parser.addArgument("--bias-patch").dest("bias_patch").type(CommaSeparatedDoubles).
                help("x0,y0,x1,y1 of the biased patch (default: whole raster)");
        return parser;
    }

    static SyntheticStack toSyntheticStack(Namespace parsed) {
        SyntheticStack synthetic = new SyntheticStack()
                .setStartDate(parsed.getString("start_date"))
                .setNumDates(parsed.getInt("num_dates"))
                .setSpacingDays(parsed.getInt("spacing"))
                .setBandwidth(parsed.getInt("bw"))
                .setMaxConnection(parsed.getInt("max_connection"))
                .setSize(parsed.getInt("length"), parsed.getInt("width"))
                .setWavelength(parsed.getDouble("wavelength"))
                .setDeformationPerStep(parsed.getDouble("deformation"));
        double[] bias = parsed.get("bias");
        if (bias != null) {
            double[] patch = parsed.get("bias_patch");
            Box box;
            if (patch == null) {
                box = Box.full(parsed.getInt("length"), parsed.getInt("width"));
            } else if (patch.length == 4) {
                box = new Box((int) patch[0], (int) patch[1], (int) patch[2], (int) patch[3]);
            } else {
                throw new IllegalArgumentException("bias patch needs 4 coordinates, got " + patch.length);
            }
            synthetic.setBias(box, bias);
        }
        return synthetic;
    }

    public static void main(String[] args) {
        ArgumentParser parser = buildParser();
        String directory;
        SyntheticStack synthetic;
        try {
            Namespace parsed = parser.parseArgs(args);
            directory = parsed.getString("directory");
            synthetic = toSyntheticStack(parsed);
        } catch (HelpScreenException e) {
            return;
        } catch (ArgumentParserException | IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            parser.printHelp(new PrintWriter(System.err, true));
            System.exit(2);
            return;
        }

        try (InterferogramStack stack = synthetic.build(directory)) {
            logger.info("wrote {} interferograms ({} in the active network) of {} x {} pixels to {}",
                    stack.getNumIfgrams(false), stack.getNumIfgrams(true), stack.getLength(), stack.getWidth(),
                    directory);
        } catch (BackingStoreException | DatasetException | IllegalArgumentException e) {
            logger.error("could not write synthetic stack: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
