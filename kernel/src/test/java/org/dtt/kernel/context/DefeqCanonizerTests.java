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

package org.dtt.kernel.context;

import org.dtt.kernel.BaseKernelTests;
import org.dtt.kernel.ir.expression.DTTConstantExpression;
import org.dtt.kernel.ir.expression.DTTExpression;
import org.junit.Assert;
import org.junit.Test;

public class DefeqCanonizerTests extends BaseKernelTests {
    @Test
    public void testRepresentative() {
        this.environment.addDefinition("fa", this.nat, this.f.call(this.a));
        DTTConstantExpression fa = new DTTConstantExpression("fa");
        DefeqCanonizer canonizer = new DefeqCanonizer(this.context);

        DTTExpression fApplied = this.f.call(this.a);
        CanonizeResult result = canonizer.canonize(fApplied);
        Assert.assertSame(fApplied, result.expression());
        Assert.assertFalse(result.mutated());

        // A different but equal object gets the existing representative
        result = canonizer.canonize(this.f.call(this.a));
        Assert.assertSame(fApplied, result.expression());
        Assert.assertFalse(result.mutated());

        // A lighter equivalent expression replaces the representative
        result = canonizer.canonize(fa);
        Assert.assertSame(fa, result.expression());
        Assert.assertTrue(result.mutated());

        result = canonizer.canonize(fApplied);
        Assert.assertSame(fa, result.expression());
        Assert.assertFalse(result.mutated());

        // Unrelated expressions get their own class
        result = canonizer.canonize(this.f.call(this.b));
        Assert.assertEquals(this.f.call(this.b), result.expression());
        Assert.assertFalse(result.mutated());
        Assert.assertEquals(2, canonizer.size());
    }
}
