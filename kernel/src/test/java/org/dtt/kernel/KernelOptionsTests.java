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

import org.dtt.kernel.dsimplify.DSimplifyVisitor;
import org.dtt.kernel.errors.KernelError;
import org.dtt.util.Logger;
import org.junit.Assert;
import org.junit.Test;

public class KernelOptionsTests {
    @Test
    public void testDefaults() {
        KernelOptions options = KernelOptions.parse();
        Assert.assertEquals(KernelOptions.DEFAULT_MAX_STEPS, options.maxSteps);
        Assert.assertFalse(options.visitInstances);
        Assert.assertTrue(options.loggingLevel.isEmpty());
        Assert.assertTrue(options.validate(new StderrErrorReporter()));
    }

    @Test
    public void testParse() {
        KernelOptions options = KernelOptions.parse(
                "--maxSteps", "50", "--visitInstances", "-T", "DSimplifyVisitor=2");
        Assert.assertEquals(50, options.maxSteps);
        Assert.assertTrue(options.visitInstances);
        Assert.assertEquals("2", options.loggingLevel.get("DSimplifyVisitor"));
        Assert.assertTrue(options.validate(new StderrErrorReporter()));
    }

    @Test
    public void testHelp() {
        Assert.assertNull(KernelOptions.parse().getUsage());
        KernelOptions options = KernelOptions.parse("--help");
        Assert.assertTrue(options.help);
        String usage = options.getUsage();
        Assert.assertNotNull(usage);
        Assert.assertTrue(usage, usage.contains("dsimplify"));
        Assert.assertTrue(usage, usage.contains("--maxSteps"));
    }

    @Test
    public void testLoggingLevels() {
        KernelOptions options = KernelOptions.parse("-T", "DSimplifyVisitor=2");
        options.setLoggingLevels();
        try {
            Assert.assertEquals(2, Logger.INSTANCE.getLoggingLevel(DSimplifyVisitor.class));
        } finally {
            Logger.INSTANCE.setLoggingLevel(DSimplifyVisitor.class, 0);
        }
    }

    @Test
    public void testInvalid() {
        KernelOptions options = KernelOptions.parse("--maxSteps", "0", "-T", "DSimplifyVisitor=high");
        StderrErrorReporter reporter = new StderrErrorReporter();
        Assert.assertFalse(options.validate(reporter));
        Assert.assertTrue(reporter.hasErrors());
        Assert.assertEquals(2, reporter.getErrorCount());
    }

    @Test(expected = KernelError.class)
    public void testUnknownOption() {
        KernelOptions.parse("--noSuchOption");
    }

    @Test(expected = KernelError.class)
    public void testUnknownLoggingClass() {
        Logger.INSTANCE.setLoggingLevel("NoSuchClass", 1);
    }
}
