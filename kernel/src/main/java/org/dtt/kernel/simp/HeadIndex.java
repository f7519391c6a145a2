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

import org.dtt.kernel.ir.expression.DTTBoundVarExpression;
import org.dtt.kernel.ir.expression.DTTConstantExpression;
import org.dtt.kernel.ir.expression.DTTExpression;
import org.dtt.kernel.ir.expression.DTTLambdaExpression;
import org.dtt.kernel.ir.expression.DTTLetExpression;
import org.dtt.kernel.ir.expression.DTTLocalExpression;
import org.dtt.kernel.ir.expression.DTTMacroExpression;
import org.dtt.kernel.ir.expression.DTTMetaExpression;
import org.dtt.kernel.ir.expression.DTTPiExpression;
import org.dtt.kernel.ir.expression.DTTSortExpression;
import org.dtt.kernel.errors.InternalKernelError;

/** Identifies the head symbol of an expression; applications are indexed by their function. */
public record HeadIndex(Kind kind, String name) {
    public enum Kind {
        CONSTANT,
        LOCAL,
        META,
        BOUND_VAR,
        SORT,
        LAMBDA,
        PI,
        LET,
        MACRO
    }

    public static HeadIndex of(DTTExpression expression) {
        DTTExpression fn = expression.getAppFn();
        if (fn.is(DTTConstantExpression.class))
            return new HeadIndex(Kind.CONSTANT, fn.to(DTTConstantExpression.class).name);
        if (fn.is(DTTLocalExpression.class))
            return new HeadIndex(Kind.LOCAL, fn.to(DTTLocalExpression.class).uniqueName);
        if (fn.is(DTTMetaExpression.class))
            return new HeadIndex(Kind.META, fn.to(DTTMetaExpression.class).name);
        if (fn.is(DTTBoundVarExpression.class))
            return new HeadIndex(Kind.BOUND_VAR, Integer.toString(fn.to(DTTBoundVarExpression.class).index));
        if (fn.is(DTTSortExpression.class))
            return new HeadIndex(Kind.SORT, "");
        if (fn.is(DTTLambdaExpression.class))
            return new HeadIndex(Kind.LAMBDA, "");
        if (fn.is(DTTPiExpression.class))
            return new HeadIndex(Kind.PI, "");
        if (fn.is(DTTLetExpression.class))
            return new HeadIndex(Kind.LET, "");
        if (fn.is(DTTMacroExpression.class))
            return new HeadIndex(Kind.MACRO, fn.to(DTTMacroExpression.class).definition);
        throw new InternalKernelError("Unexpected expression kind", expression);
    }

    @Override
    public String toString() {
        if (this.name.isEmpty())
            return this.kind.toString();
        return this.kind + " " + this.name;
    }
}
