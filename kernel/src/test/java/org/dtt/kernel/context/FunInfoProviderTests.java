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
import org.dtt.kernel.ir.BinderInfo;
import org.dtt.kernel.ir.expression.DTTConstantExpression;
import org.dtt.kernel.ir.expression.DTTSortExpression;
import org.junit.Assert;
import org.junit.Test;

public class FunInfoProviderTests extends BaseKernelTests {
    @Test
    public void testParameters() {
        // k : {Nat} -> [Prop] -> Nat -> Nat
        this.environment.addAxiom("k", this.pi(BinderInfo.IMPLICIT, this.nat,
                this.pi(BinderInfo.INST_IMPLICIT, DTTSortExpression.PROP, this.arrow(this.nat, this.nat))));
        FunInfoProvider provider = new FunInfoProvider(this.context);
        DTTConstantExpression k = new DTTConstantExpression("k");

        FunInfo info = provider.getFunInfo(k, 3);
        Assert.assertEquals(3, info.size());
        Assert.assertTrue(info.get(0).isImplicit());
        Assert.assertTrue(info.get(1).isInstImplicit());
        Assert.assertTrue(info.get(1).isProp());
        Assert.assertFalse(info.get(2).isInstImplicit());

        // Only as many parameters as arguments
        Assert.assertEquals(1, provider.getFunInfo(k, 1).size());
        // Not more parameters than the type has
        Assert.assertEquals(3, provider.getFunInfo(k, 5).size());
        // Unknown heads
        Assert.assertEquals(0, provider.getFunInfo(new DTTConstantExpression("unknown"), 2).size());
        Assert.assertEquals(0, provider.getFunInfo(this.nat, 1).size());
    }
}
