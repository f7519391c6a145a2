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
import org.dtt.util.Utilities;

import java.util.List;

/**
 * Replaces the loose bound variables of an expression with closed values.
 * The last value replaces index 0, the value before it index 1, and so on;
 * loose indices beyond the values are lowered by the number of values.
 * This is the operation used when descending under a chain of binders:
 * the values are the locals created for the binders, outermost first. */
public class Instantiate extends InnerRewriteVisitor {
    final List<? extends DTTExpression> values;

    public Instantiate(List<? extends DTTExpression> values) {
        for (DTTExpression value: values)
            Utilities.enforce(!value.hasLooseBVars(), "Instantiating with an open value " + value);
        this.values = values;
    }

    @Override
    protected boolean unchanged(DTTExpression expression) {
        return expression.looseBVarRange <= this.offset;
    }

    @Override
    public DTTExpression apply(DTTExpression expression) {
        if (this.values.isEmpty() || !expression.hasLooseBVars())
            return expression;
        return super.apply(expression);
    }

    @Override
    public VisitDecision preorder(DTTBoundVarExpression expression) {
        int index = expression.index;
        int size = this.values.size();
        if (index < this.offset) {
            this.map(expression, expression);
        } else if (index < this.offset + size) {
            this.map(expression, this.values.get(size - 1 - (index - this.offset)));
        } else {
            this.map(expression, new DTTBoundVarExpression(index - size));
        }
        return VisitDecision.STOP;
    }
}
