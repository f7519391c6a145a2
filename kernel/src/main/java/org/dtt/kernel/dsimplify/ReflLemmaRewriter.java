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

import org.dtt.kernel.ir.expression.DTTExpression;
import org.dtt.kernel.simp.SimpLemma;
import org.dtt.kernel.simp.SimpLemmas;
import org.dtt.util.IWritesLogs;
import org.dtt.util.Logger;

import javax.annotation.Nullable;
import java.util.List;

/**
 * Rewrites each simplified node with the unconditional lemmas of a
 * {@link SimpLemmas} database until no lemma applies. */
public class ReflLemmaRewriter implements IDSimplifyHooks, IWritesLogs {
    static final String OPERATION = "dsimplify.rewrite";

    final SimpLemmas lemmas;
    long rewriteCount;

    public ReflLemmaRewriter(SimpLemmas lemmas) {
        this.lemmas = lemmas;
        this.rewriteCount = 0;
    }

    /** Number of lemma applications which changed an expression. */
    public long getRewriteCount() {
        return this.rewriteCount;
    }

    /** The result of the first unconditional lemma which changes 'expression', or null. */
    @Nullable
    DTTExpression rewrite(DTTExpression expression, List<SimpLemma> candidates) {
        for (SimpLemma lemma: candidates) {
            if (!lemma.refl)
                continue;
            DTTExpression result = lemma.rewrite(expression);
            if (result != null && !result.equals(expression)) {
                Logger.INSTANCE.belowLevel(this, 2)
                        .append(lemma.name)
                        .append(": ")
                        .append(expression)
                        .append(" => ")
                        .append(result)
                        .newline();
                return result;
            }
        }
        return null;
    }

    @Nullable
    @Override
    public HookResult post(DTTExpression expression, DSimplifyVisitor engine) {
        DTTExpression current = expression;
        while (true) {
            engine.checkSystem(OPERATION);
            engine.incNumSteps();
            @Nullable List<SimpLemma> candidates = this.lemmas.find(current);
            if (candidates == null)
                break;
            @Nullable DTTExpression next = this.rewrite(current, candidates);
            if (next == null)
                break;
            this.rewriteCount++;
            current = next;
        }
        if (current.equals(expression))
            return null;
        return HookResult.cont(current);
    }
}
