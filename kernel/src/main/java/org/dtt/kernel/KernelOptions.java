/*
 * Copyright 2023 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.dtt.kernel;

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import org.dtt.kernel.errors.KernelError;
import org.dtt.util.IValidate;
import org.dtt.util.Logger;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Map;

@SuppressWarnings("CanBeFinal")
// These fields cannot be final, since JCommander writes them through reflection.
public class KernelOptions implements IValidate {
    public static final long DEFAULT_MAX_STEPS = 100_000;

    @Parameter(names = "--maxSteps", description = "Maximum number of simplification steps")
    public long maxSteps = DEFAULT_MAX_STEPS;
    @Parameter(names = "--visitInstances",
            description = "Simplify instance-implicit arguments instead of canonicalizing them")
    public boolean visitInstances = false;
    @DynamicParameter(names = "-T",
            description = "Specify logging level for a class (can be repeated)")
    public Map<String, String> loggingLevel = new HashMap<>();
    @Parameter(names = {"-h", "--help", "-"}, help = true, description = "Show this message and exit")
    public boolean help;
    /** Usage message, set by {@link #parse} when help is requested. */
    @Nullable
    String usage = null;

    /** Parse options from command-line style arguments.
     * @throws KernelError if the arguments cannot be parsed. */
    public static KernelOptions parse(String... argv) {
        KernelOptions options = new KernelOptions();
        JCommander commander = JCommander.newBuilder()
                .addObject(options)
                .build();
        commander.setProgramName("dsimplify");
        try {
            commander.parse(argv);
        } catch (ParameterException ex) {
            throw new KernelError(ex.getMessage());
        }
        if (options.help) {
            StringBuilder builder = new StringBuilder();
            commander.getUsageFormatter().usage(builder);
            options.usage = builder.toString();
        }
        return options;
    }

    /** The usage message if help was requested, null otherwise. */
    @Nullable
    public String getUsage() {
        return this.usage;
    }

    @Override
    public boolean validate(IErrorReporter reporter) {
        boolean valid = true;
        if (this.maxSteps <= 0) {
            reporter.reportError("Invalid option", "--maxSteps must be positive, got " + this.maxSteps);
            valid = false;
        }
        for (Map.Entry<String, String> entry: this.loggingLevel.entrySet()) {
            try {
                Integer.parseInt(entry.getValue());
            } catch (NumberFormatException ex) {
                reporter.reportError("Invalid option",
                        "-T option must be followed by 'class=number'; could not parse " + entry);
                valid = false;
            }
        }
        return valid;
    }

    /** Apply the logging levels to the global logger. */
    public void setLoggingLevels() {
        for (Map.Entry<String, String> entry: this.loggingLevel.entrySet()) {
            int level = Integer.parseInt(entry.getValue());
            Logger.INSTANCE.setLoggingLevel(entry.getKey(), level);
        }
    }

    @Override
    public String toString() {
        return "KernelOptions{" +
                "\n\tmaxSteps=" + this.maxSteps +
                ",\n\tvisitInstances=" + this.visitInstances +
                ",\n\tloggingLevel=" + this.loggingLevel +
                '}';
    }
}
