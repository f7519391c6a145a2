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

package org.dtt.kernel.dsimplify;

import org.dtt.kernel.IErrorReporter;
import org.dtt.kernel.KernelOptions;
import org.dtt.kernel.StderrErrorReporter;
import org.dtt.kernel.context.DefeqCanonizer;
import org.dtt.kernel.context.FunInfoProvider;
import org.dtt.kernel.context.InterruptCheck;
import org.dtt.kernel.context.TypeContext;
import org.dtt.kernel.errors.KernelError;
import org.dtt.kernel.ir.expression.DTTExpression;
import org.dtt.kernel.simp.SimpLemmas;

import javax.annotation.Nullable;

/** Simplifies expressions by rewriting them with unconditional lemmas to a fixed point. */
public class DSimplify {
    final TypeContext context;
    @Nullable
    DSimplifyVisitor lastVisitor;
    @Nullable
    ReflLemmaRewriter lastRewriter;

    public DSimplify(TypeContext context) {
        this.context = context;
        this.lastVisitor = null;
        this.lastRewriter = null;
    }

    public DSimplifyVisitor createVisitor(IDSimplifyHooks hooks, long maxSteps, boolean visitInstances) {
        return new DSimplifyVisitor(this.context, new FunInfoProvider(this.context),
                new DefeqCanonizer(this.context), hooks, InterruptCheck.INSTANCE,
                maxSteps, visitInstances);
    }

    public DTTExpression simplify(DTTExpression expression, SimpLemmas lemmas,
                                  long maxSteps, boolean visitInstances) {
        this.lastRewriter = new ReflLemmaRewriter(lemmas);
        this.lastVisitor = this.createVisitor(this.lastRewriter, maxSteps, visitInstances);
        return this.lastVisitor.apply(expression);
    }

    public DTTExpression simplify(DTTExpression expression, SimpLemmas lemmas, KernelOptions options) {
        IErrorReporter reporter = new StderrErrorReporter();
        if (!options.validate(reporter))
            throw new KernelError("Invalid options " + options);
        options.setLoggingLevels();
        return this.simplify(expression, lemmas, options.maxSteps, options.visitInstances);
    }

    /** The visitor used by the last call to simplify. */
    @Nullable
    public DSimplifyVisitor getLastVisitor() {
        return this.lastVisitor;
    }

    /** The rewriter used by the last call to simplify. */
    @Nullable
    public ReflLemmaRewriter getLastRewriter() {
        return this.lastRewriter;
    }
}
