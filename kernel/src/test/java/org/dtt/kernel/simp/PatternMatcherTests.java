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

package org.dtt.kernel.simp;

import org.dtt.kernel.BaseKernelTests;
import org.dtt.kernel.ir.expression.DTTExpression;
import org.dtt.kernel.ir.expression.DTTLambdaExpression;
import org.junit.Assert;
import org.junit.Test;

import java.util.Map;

public class PatternMatcherTests extends BaseKernelTests {
    @Test
    public void testMatch() {
        Map<String, DTTExpression> assignment = PatternMatcher.match(
                this.f.call(meta("x")), this.f.call(this.g.call(this.a)));
        Assert.assertNotNull(assignment);
        Assert.assertEquals(1, assignment.size());
        Assert.assertEquals(this.g.call(this.a), assignment.get("x"));

        Assert.assertNull(PatternMatcher.match(this.f.call(meta("x")), this.g.call(this.a)));
        Assert.assertNull(PatternMatcher.match(this.f.call(meta("x")), this.pair.call(this.a, this.b)));
        Assert.assertNull(PatternMatcher.match(this.f.call(this.a), this.f.call(this.b)));
        Assert.assertNotNull(PatternMatcher.match(this.f.call(this.a), this.f.call(this.a)));
    }

    @Test
    public void testRepeatedMeta() {
        DTTExpression pattern = this.pair.call(meta("x"), meta("x"));
        Assert.assertNotNull(PatternMatcher.match(pattern, this.pair.call(this.f.call(this.a), this.f.call(this.a))));
        Assert.assertNull(PatternMatcher.match(pattern, this.pair.call(this.a, this.b)));
    }

    @Test
    public void testUnderBinders() {
        DTTExpression pattern = new DTTLambdaExpression("x", this.nat, this.pair.call(bvar(0), meta("y")));
        Map<String, DTTExpression> assignment = PatternMatcher.match(pattern,
                new DTTLambdaExpression("z", this.nat, this.pair.call(bvar(0), this.a)));
        Assert.assertNotNull(assignment);
        Assert.assertEquals(this.a, assignment.get("y"));
        // A metavariable cannot capture a bound variable
        Assert.assertNull(PatternMatcher.match(pattern,
                new DTTLambdaExpression("z", this.nat, this.pair.call(bvar(0), bvar(0)))));
    }
}
