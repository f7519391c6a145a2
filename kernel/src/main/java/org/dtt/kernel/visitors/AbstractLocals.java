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

package org.dtt.kernel.visitors;

import org.dtt.kernel.ir.expression.DTTBoundVarExpression;
import org.dtt.kernel.ir.expression.DTTExpression;
import org.dtt.kernel.ir.expression.DTTLocalExpression;

import java.util.List;

/**
 * Inverse of {@link Instantiate}: replaces the given locals with bound variables.
 * The last local becomes index 0 at the top level.  Loose bound variables
 * already present are lifted over the new binders. */
public class AbstractLocals extends InnerRewriteVisitor {
    final List<DTTLocalExpression> locals;

    public AbstractLocals(List<DTTLocalExpression> locals) {
        this.locals = locals;
    }

    @Override
    public DTTExpression apply(DTTExpression expression) {
        if (this.locals.isEmpty())
            return expression;
        return super.apply(expression);
    }

    @Override
    public VisitDecision preorder(DTTLocalExpression expression) {
        int size = this.locals.size();
        for (int i = size - 1; i >= 0; i--) {
            if (this.locals.get(i).equals(expression)) {
                this.map(expression, new DTTBoundVarExpression(this.offset + size - 1 - i));
                return VisitDecision.STOP;
            }
        }
        this.map(expression, expression);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(DTTBoundVarExpression expression) {
        if (expression.index < this.offset)
            this.map(expression, expression);
        else
            this.map(expression, new DTTBoundVarExpression(expression.index + this.locals.size()));
        return VisitDecision.STOP;
    }
}
