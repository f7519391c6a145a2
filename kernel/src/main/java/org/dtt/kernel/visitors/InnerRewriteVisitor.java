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

import org.dtt.kernel.ir.IDTTNode;
import org.dtt.kernel.ir.expression.DTTAppExpression;
import org.dtt.kernel.ir.expression.DTTBindingExpression;
import org.dtt.kernel.ir.expression.DTTExpression;
import org.dtt.kernel.ir.expression.DTTLetExpression;
import org.dtt.kernel.ir.expression.DTTMacroExpression;
import org.dtt.util.IWritesLogs;
import org.dtt.util.Linq;
import org.dtt.util.Logger;

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Base class for visitors which rewrite expressions.
 * This class recurses over the structure of expressions and if any children
 * have changed builds a new version of the node.  Classes that extend this
 * should override the preorder methods and ignore the postorder methods.
 *
 * <p>The visitor keeps track of the number of binders crossed in {@link #offset};
 * a bound variable with index i refers to a binder outside the visited root
 * iff i >= offset. */
public abstract class InnerRewriteVisitor
        extends InnerVisitor
        implements IWritesLogs {
    /** Number of binders between the root and the current node. */
    protected int offset;

    protected InnerRewriteVisitor() {
        this.offset = 0;
    }

    /** Result produced by the last preorder invocation. */
    @Nullable
    protected DTTExpression lastResult;

    protected DTTExpression getResult() {
        return Objects.requireNonNull(this.lastResult);
    }

    @Override
    public DTTExpression apply(DTTExpression expression) {
        this.startVisit(expression);
        this.offset = 0;
        expression.accept(this);
        this.endVisit();
        return this.getResult();
    }

    /**
     * Replace the 'old' expression with the 'newOp' expression if
     * any of its fields differs. */
    protected void map(DTTExpression old, DTTExpression newOp) {
        if (old == newOp || old.sameFields(newOp)) {
            this.lastResult = old;
            return;
        }

        Logger.INSTANCE.belowLevel(this, 2)
                .appendSupplier(this::toString)
                .append(":")
                .appendSupplier(old::toString)
                .append(" -> ")
                .appendSupplier(newOp::toString)
                .newline();
        this.lastResult = newOp;
    }

    /** True if this expression is known to be unaffected by the rewriting,
     * so the traversal does not need to descend into it. */
    protected boolean unchanged(DTTExpression expression) {
        return false;
    }

    protected DTTExpression transform(DTTExpression expression) {
        expression.accept(this);
        return this.getResult();
    }

    /** Transform an expression which lives under one more binder. */
    protected DTTExpression transformUnderBinder(DTTExpression expression) {
        this.offset++;
        try {
            return this.transform(expression);
        } finally {
            this.offset--;
        }
    }

    protected DTTExpression[] transform(DTTExpression[] expressions) {
        return Linq.map(expressions, this::transform, DTTExpression.class);
    }

    @Override
    public VisitDecision preorder(IDTTNode node) {
        DTTExpression expression = node.to(DTTExpression.class);
        this.map(expression, expression);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(DTTMacroExpression expression) {
        if (this.unchanged(expression)) {
            this.map(expression, expression);
            return VisitDecision.STOP;
        }
        this.push(expression);
        DTTExpression[] arguments = this.transform(expression.arguments);
        this.pop(expression);
        this.map(expression, expression.replaceArguments(arguments));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(DTTBindingExpression expression) {
        if (this.unchanged(expression)) {
            this.map(expression, expression);
            return VisitDecision.STOP;
        }
        this.push(expression);
        DTTExpression domain = this.transform(expression.domain);
        DTTExpression body = this.transformUnderBinder(expression.body);
        this.pop(expression);
        this.map(expression, expression.rebuild(domain, body));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(DTTLetExpression expression) {
        if (this.unchanged(expression)) {
            this.map(expression, expression);
            return VisitDecision.STOP;
        }
        this.push(expression);
        DTTExpression type = this.transform(expression.type);
        DTTExpression value = this.transform(expression.value);
        DTTExpression body = this.transformUnderBinder(expression.body);
        this.pop(expression);
        this.map(expression, expression.rebuild(type, value, body));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(DTTAppExpression expression) {
        if (this.unchanged(expression)) {
            this.map(expression, expression);
            return VisitDecision.STOP;
        }
        this.push(expression);
        DTTExpression function = this.transform(expression.function);
        DTTExpression[] arguments = this.transform(expression.arguments);
        this.pop(expression);
        DTTExpression result;
        if (function == expression.function)
            result = expression.replaceArguments(arguments);
        else
            result = function.call(arguments);
        this.map(expression, result);
        return VisitDecision.STOP;
    }
}
