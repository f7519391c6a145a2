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

import org.dtt.kernel.context.Environment;
import org.dtt.kernel.context.TypeContext;
import org.dtt.kernel.ir.BinderInfo;
import org.dtt.kernel.ir.expression.DTTBoundVarExpression;
import org.dtt.kernel.ir.expression.DTTConstantExpression;
import org.dtt.kernel.ir.expression.DTTExpression;
import org.dtt.kernel.ir.expression.DTTMetaExpression;
import org.dtt.kernel.ir.expression.DTTPiExpression;
import org.dtt.kernel.ir.expression.DTTSortExpression;
import org.junit.Before;

/** Common declarations used by kernel tests. */
public abstract class BaseKernelTests {
    protected Environment environment;
    protected TypeContext context;

    protected final DTTConstantExpression nat = new DTTConstantExpression("Nat");
    protected final DTTConstantExpression a = new DTTConstantExpression("a");
    protected final DTTConstantExpression b = new DTTConstantExpression("b");
    protected final DTTConstantExpression c = new DTTConstantExpression("c");
    protected final DTTConstantExpression f = new DTTConstantExpression("f");
    protected final DTTConstantExpression g = new DTTConstantExpression("g");
    protected final DTTConstantExpression h = new DTTConstantExpression("h");
    /** Nat -> Nat -> Nat */
    protected final DTTConstantExpression pair = new DTTConstantExpression("pair");
    /** Nat -> Nat -> Nat -> Nat */
    protected final DTTConstantExpression triple = new DTTConstantExpression("triple");

    protected DTTExpression arrow(DTTExpression... types) {
        DTTExpression result = types[types.length - 1];
        for (int i = types.length - 2; i >= 0; i--)
            result = new DTTPiExpression("x", types[i], result);
        return result;
    }

    protected DTTExpression pi(BinderInfo info, DTTExpression domain, DTTExpression body) {
        return new DTTPiExpression("x", domain, info, body);
    }

    protected static DTTExpression bvar(int index) {
        return new DTTBoundVarExpression(index);
    }

    protected static DTTMetaExpression meta(String name) {
        return new DTTMetaExpression(name);
    }

    @Before
    public void createEnvironment() {
        this.environment = new Environment();
        this.environment.addAxiom("Nat", DTTSortExpression.TYPE);
        for (String name: new String[] { "a", "b", "c" })
            this.environment.addAxiom(name, this.nat);
        for (String name: new String[] { "f", "g", "h" })
            this.environment.addAxiom(name, this.arrow(this.nat, this.nat));
        this.environment.addAxiom("pair", this.arrow(this.nat, this.nat, this.nat));
        this.environment.addAxiom("triple", this.arrow(this.nat, this.nat, this.nat, this.nat));
        this.context = new TypeContext(this.environment);
    }
}
