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

package org.dtt.kernel.ir.expression;

import org.dtt.kernel.ir.DTTNode;

import java.util.Arrays;

/**
 * Base class for all expressions.
 *
 * <p>Expressions are immutable.  Equality is structural (up to the names and
 * binder information attached to binders, which carry no meaning in a
 * de Bruijn representation); reference equality is checked first.
 * The hash code, the loose bound variable range and the weight are computed
 * once. */
public abstract class DTTExpression extends DTTNode {
    /** All loose bound variables of this expression have an index smaller than this. */
    public final int looseBVarRange;
    /** Number of nodes in the tree. */
    public final int weight;
    private int hash;

    protected DTTExpression(int looseBVarRange, int weight) {
        this.looseBVarRange = looseBVarRange;
        this.weight = weight;
    }

    public boolean hasLooseBVars() {
        return this.looseBVarRange > 0;
    }

    /** Compare the fields of two expressions of the same class.
     * Children are compared with {@link #equals}. */
    protected abstract boolean sameStructure(DTTExpression other);

    protected abstract int computeHash();

    @Override
    public final boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || this.getClass() != o.getClass())
            return false;
        DTTExpression other = (DTTExpression) o;
        if (this.hashCode() != other.hashCode() || this.weight != other.weight)
            return false;
        return this.sameStructure(other);
    }

    @Override
    public final int hashCode() {
        int h = this.hash;
        if (h == 0) {
            h = this.computeHash();
            if (h == 0)
                h = 1;
            this.hash = h;
        }
        return h;
    }

    /** Apply this expression to some arguments.  If this is already an
     * application the arguments are appended to the existing ones. */
    public DTTExpression call(DTTExpression... arguments) {
        if (arguments.length == 0)
            return this;
        DTTAppExpression app = this.as(DTTAppExpression.class);
        if (app != null) {
            DTTExpression[] args = Arrays.copyOf(app.arguments, app.arguments.length + arguments.length);
            System.arraycopy(arguments, 0, args, app.arguments.length, arguments.length);
            return new DTTAppExpression(app.function, args);
        }
        return new DTTAppExpression(this, arguments);
    }

    /** The head of an application, or the expression itself. */
    public DTTExpression getAppFn() {
        DTTAppExpression app = this.as(DTTAppExpression.class);
        if (app != null)
            return app.function;
        return this;
    }

    /** The arguments of an application; empty if this is not an application. */
    public DTTExpression[] getAppArgs() {
        DTTAppExpression app = this.as(DTTAppExpression.class);
        if (app != null)
            return app.arguments;
        return new DTTExpression[0];
    }

    static int maxRange(DTTExpression... expressions) {
        int result = 0;
        for (DTTExpression e: expressions)
            result = Math.max(result, e.looseBVarRange);
        return result;
    }

    static int totalWeight(DTTExpression... expressions) {
        int result = 1;
        for (DTTExpression e: expressions)
            result += e.weight;
        return result;
    }

    static boolean allEqual(DTTExpression[] left, DTTExpression[] right) {
        if (left.length != right.length)
            return false;
        for (int i = 0; i < left.length; i++)
            if (!left[i].equals(right[i]))
                return false;
        return true;
    }
}
