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

import org.dtt.kernel.errors.ResourceExhaustedException;
import org.dtt.kernel.ir.expression.DTTAppExpression;
import org.dtt.kernel.ir.expression.DTTBindingExpression;
import org.dtt.kernel.ir.expression.DTTConstantExpression;
import org.dtt.kernel.ir.expression.DTTExpression;
import org.dtt.kernel.ir.expression.DTTLambdaExpression;
import org.dtt.kernel.ir.expression.DTTLetExpression;
import org.dtt.kernel.ir.expression.DTTLocalExpression;
import org.dtt.kernel.visitors.AbstractLocals;
import org.dtt.kernel.visitors.InnerRewriteVisitor;
import org.dtt.kernel.visitors.Instantiate;
import org.dtt.kernel.visitors.VisitDecision;
import org.dtt.util.Linq;
import org.dtt.util.NameGen;

import java.util.Arrays;
import java.util.List;

/**
 * Normalizes a closed expression by unfolding definitions (delta),
 * reducing applications of lambdas (beta) and inlining let values (zeta).
 * Binders are traversed in locally-nameless form, so every expression
 * the visitor sees is closed.  Reduction is bounded by a number of unfoldings. */
public class Unfold extends InnerRewriteVisitor {
    static final NameGen names = new NameGen("_unfold.");

    final Environment environment;
    final long maxUnfoldings;
    long unfoldings;

    public Unfold(Environment environment, long maxUnfoldings) {
        this.environment = environment;
        this.maxUnfoldings = maxUnfoldings;
        this.unfoldings = 0;
    }

    void count() {
        if (this.unfoldings >= this.maxUnfoldings)
            throw new ResourceExhaustedException("Unfolding", this.maxUnfoldings);
        this.unfoldings++;
    }

    @Override
    public VisitDecision preorder(DTTConstantExpression expression) {
        Declaration decl = this.environment.find(expression.name);
        if (decl == null || decl.value() == null) {
            this.map(expression, expression);
        } else {
            this.count();
            this.map(expression, this.transform(decl.value()));
        }
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(DTTBindingExpression expression) {
        this.push(expression);
        DTTExpression domain = this.transform(expression.domain);
        DTTLocalExpression local = new DTTLocalExpression(
                names.nextName(), expression.name, domain, expression.binderInfo);
        List<DTTLocalExpression> locals = Linq.list(local);
        DTTExpression body = this.transform(new Instantiate(locals).apply(expression.body));
        this.pop(expression);
        body = new AbstractLocals(locals).apply(body);
        this.map(expression, expression.rebuild(domain, body));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(DTTLetExpression expression) {
        this.count();
        this.push(expression);
        DTTExpression value = this.transform(expression.value);
        DTTExpression body = this.transform(new Instantiate(Linq.list(value)).apply(expression.body));
        this.pop(expression);
        this.map(expression, body);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(DTTAppExpression expression) {
        this.push(expression);
        DTTExpression function = this.transform(expression.function);
        DTTExpression[] arguments = this.transform(expression.arguments);
        this.pop(expression);
        this.map(expression, this.beta(function, arguments));
        return VisitDecision.STOP;
    }

    /** Apply an already normalized function to normalized arguments. */
    DTTExpression beta(DTTExpression function, DTTExpression[] arguments) {
        DTTLambdaExpression lambda = function.as(DTTLambdaExpression.class);
        if (lambda == null)
            return function.call(arguments);
        this.count();
        DTTExpression body = new Instantiate(Linq.list(arguments[0])).apply(lambda.body);
        DTTExpression result = this.transform(body);
        DTTExpression[] rest = Arrays.copyOfRange(arguments, 1, arguments.length);
        if (rest.length == 0)
            return result;
        return this.beta(result.getAppFn(), concat(result.getAppArgs(), rest));
    }

    static DTTExpression[] concat(DTTExpression[] left, DTTExpression[] right) {
        DTTExpression[] result = Arrays.copyOf(left, left.length + right.length);
        System.arraycopy(right, 0, result, left.length, right.length);
        return result;
    }
}
