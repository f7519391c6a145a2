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

import org.dtt.kernel.errors.InternalKernelError;
import org.dtt.kernel.ir.BinderInfo;
import org.dtt.kernel.ir.expression.DTTExpression;
import org.dtt.kernel.ir.expression.DTTLocalExpression;
import org.dtt.kernel.visitors.AbstractLocals;
import org.dtt.kernel.visitors.Instantiate;
import org.dtt.util.IWritesLogs;
import org.dtt.util.Logger;
import org.dtt.util.NameGen;
import org.dtt.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The local context used while traversing expressions.
 * Locals are pushed when descending under binders and popped in LIFO order. */
public class TypeContext implements IWritesLogs {
    static final NameGen names = new NameGen("_local.");
    /** Bound on delta/beta/zeta steps performed by one definitional equality check. */
    public static final long MAX_UNFOLDINGS = 1_000;

    final Environment environment;
    final List<DTTLocalExpression> localDecls;
    final Map<String, DTTExpression> letValues;

    public TypeContext(Environment environment) {
        this.environment = environment;
        this.localDecls = new ArrayList<>();
        this.letValues = new HashMap<>();
    }

    public Environment getEnvironment() {
        return this.environment;
    }

    public TmpLocals tmpLocals() {
        return new TmpLocals(this);
    }

    /** Create a fresh local and push it on the context. */
    DTTLocalExpression pushLocal(String prettyName, DTTExpression type, BinderInfo binderInfo) {
        DTTLocalExpression local = new DTTLocalExpression(names.nextName(), prettyName, type, binderInfo);
        this.localDecls.add(local);
        Logger.INSTANCE.belowLevel(this, 3)
                .append("Push ")
                .append(local.uniqueName)
                .append(" : ")
                .append(type)
                .newline();
        return local;
    }

    DTTLocalExpression pushLet(String prettyName, DTTExpression type, DTTExpression value) {
        DTTLocalExpression local = this.pushLocal(prettyName, type, BinderInfo.DEFAULT);
        this.letValues.put(local.uniqueName, value);
        return local;
    }

    /** Pop the most recent local, which must be 'expected'. */
    void popLocal(DTTLocalExpression expected) {
        if (this.localDecls.isEmpty())
            throw new InternalKernelError("Popping from an empty local context", expected);
        DTTLocalExpression last = Utilities.removeLast(this.localDecls);
        if (last != expected)
            throw new InternalKernelError("Corrupted local context: popping " + expected.uniqueName
                    + " instead of " + last.uniqueName, expected);
        this.letValues.remove(last.uniqueName);
        Logger.INSTANCE.belowLevel(this, 3)
                .append("Pop ")
                .append(last.uniqueName)
                .newline();
    }

    /** Number of locals currently in scope. */
    public int size() {
        return this.localDecls.size();
    }

    public boolean inScope(DTTLocalExpression local) {
        return this.localDecls.contains(local);
    }

    /** The value of a local introduced by a let, or null. */
    @Nullable
    public DTTExpression getLetValue(DTTLocalExpression local) {
        return this.letValues.get(local.uniqueName);
    }

    /** Replace loose bound variables with locals; the last local replaces index 0. */
    public DTTExpression instantiateRev(DTTExpression expression, List<DTTLocalExpression> locals) {
        return new Instantiate(locals).apply(expression);
    }

    /** Replace locals with bound variables; the last local becomes index 0. */
    public DTTExpression abstractLocals(DTTExpression expression, List<DTTLocalExpression> locals) {
        return new AbstractLocals(locals).apply(expression);
    }

    /** Definitional equality: syntactic equality after unfolding
     * definitions and performing beta and zeta reductions. */
    public boolean isDefEq(DTTExpression left, DTTExpression right) {
        if (left.equals(right))
            return true;
        if (left.hasLooseBVars() || right.hasLooseBVars())
            return false;
        DTTExpression l = this.normalize(left);
        DTTExpression r = this.normalize(right);
        return l.equals(r);
    }

    /** Fully reduce a closed expression. */
    public DTTExpression normalize(DTTExpression expression) {
        return new Unfold(this.environment, MAX_UNFOLDINGS).apply(expression);
    }
}
