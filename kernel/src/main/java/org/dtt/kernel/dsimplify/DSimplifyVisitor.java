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

import org.dtt.kernel.backend.ToJsonVisitor;
import org.dtt.kernel.context.CanonizeResult;
import org.dtt.kernel.context.FunInfo;
import org.dtt.kernel.context.ICancellationCheck;
import org.dtt.kernel.context.IDefeqCanonizer;
import org.dtt.kernel.context.IFunInfoProvider;
import org.dtt.kernel.context.TmpLocals;
import org.dtt.kernel.context.TypeContext;
import org.dtt.kernel.errors.InternalKernelError;
import org.dtt.kernel.errors.ResourceExhaustedException;
import org.dtt.kernel.ir.expression.DTTAppExpression;
import org.dtt.kernel.ir.expression.DTTBindingExpression;
import org.dtt.kernel.ir.expression.DTTBoundVarExpression;
import org.dtt.kernel.ir.expression.DTTExpression;
import org.dtt.kernel.ir.expression.DTTLambdaExpression;
import org.dtt.kernel.ir.expression.DTTLetExpression;
import org.dtt.kernel.ir.expression.DTTMacroExpression;
import org.dtt.kernel.visitors.InnerRewriteVisitor;
import org.dtt.kernel.visitors.VisitDecision;
import org.dtt.util.IWritesLogs;
import org.dtt.util.Logger;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Map;

/**
 * Simplifies an expression bottom-up using a pluggable strategy.
 *
 * <p>Each node is visited at most once per pass: results are cached by structural equality.
 * Binders are opened with fresh locals from the {@link TypeContext} so that hooks
 * only ever see closed expressions.  A node is rebuilt only if one of its children changed.
 *
 * <p>Instance-implicit arguments of applications are not simplified; they are replaced
 * by their canonical representative.  Canonicalization can change representatives
 * returned earlier, which makes cached results stale; in that case the cache is
 * discarded and the whole expression is simplified again.
 *
 * <p>Every node visit and every rewrite attempt counts as a step; exceeding
 * the step limit aborts the simplification. */
public class DSimplifyVisitor extends InnerRewriteVisitor implements IWritesLogs {
    static final String OPERATION = "dsimplify";

    final TypeContext context;
    final IFunInfoProvider funInfo;
    final IDefeqCanonizer canonizer;
    final IDSimplifyHooks hooks;
    final ICancellationCheck cancellation;
    final long maxSteps;
    /** If true instance-implicit arguments are simplified like any other argument. */
    final boolean visitInstances;

    final Map<DTTExpression, DTTExpression> cache;
    long numSteps;
    boolean needRestart;
    int restartCount;

    public DSimplifyVisitor(TypeContext context, IFunInfoProvider funInfo, IDefeqCanonizer canonizer,
                            IDSimplifyHooks hooks, ICancellationCheck cancellation,
                            long maxSteps, boolean visitInstances) {
        this.context = context;
        this.funInfo = funInfo;
        this.canonizer = canonizer;
        this.hooks = hooks;
        this.cancellation = cancellation;
        this.maxSteps = maxSteps;
        this.visitInstances = visitInstances;
        this.cache = new HashMap<>();
        this.numSteps = 0;
        this.needRestart = false;
        this.restartCount = 0;
    }

    public TypeContext getTypeContext() {
        return this.context;
    }

    public long getNumSteps() {
        return this.numSteps;
    }

    public int getRestartCount() {
        return this.restartCount;
    }

    /** Throws if the host asked for cancellation. */
    public void checkSystem(String operation) {
        this.cancellation.check(operation);
    }

    /** Account for one step.
     * @throws ResourceExhaustedException if the step limit has been reached. */
    public void incNumSteps() {
        if (this.numSteps >= this.maxSteps)
            throw new ResourceExhaustedException(OPERATION, this.maxSteps);
        this.numSteps++;
    }

    @Override
    public DTTExpression apply(DTTExpression root) {
        this.startVisit(root);
        Logger.INSTANCE.belowLevel(this, 4)
                .append("Input: ")
                .appendSupplier(() -> ToJsonVisitor.toJsonString(root))
                .newline();
        while (true) {
            this.needRestart = false;
            DTTExpression result = this.visit(root);
            if (!this.needRestart) {
                this.endVisit();
                return result;
            }
            this.restartCount++;
            Logger.INSTANCE.belowLevel(this, 1)
                    .append("Canonical instance changed, restarting (")
                    .append(this.restartCount)
                    .append(")")
                    .newline();
            this.cache.clear();
        }
    }

    /** Simplify one expression. */
    public DTTExpression visit(DTTExpression expression) {
        this.checkSystem(OPERATION);
        this.incNumSteps();
        Logger.INSTANCE.belowLevel(this, 3)
                .append(OPERATION)
                .append(" [")
                .append(this.numSteps)
                .append("]: ")
                .append(expression)
                .newline();

        DTTExpression cached = this.cache.get(expression);
        if (cached != null)
            return cached.equals(expression) ? expression : cached;

        DTTExpression current = expression;
        @Nullable HookResult pre = this.hooks.pre(expression, this);
        if (pre != null) {
            if (pre.decision().stop()) {
                this.cache.put(expression, pre.expression());
                return pre.expression();
            }
            current = pre.expression();
        }

        DTTExpression result = this.transform(current);
        while (true) {
            @Nullable HookResult post = this.hooks.post(result, this);
            if (post == null)
                break;
            result = post.expression();
            if (post.decision().stop())
                break;
        }
        this.cache.put(expression, result);
        return result;
    }

    DTTExpression[] visit(DTTExpression[] expressions) {
        DTTExpression[] result = new DTTExpression[expressions.length];
        for (int i = 0; i < expressions.length; i++)
            result[i] = this.visit(expressions[i]);
        return result;
    }

    @Override
    public VisitDecision preorder(DTTBoundVarExpression expression) {
        throw new InternalKernelError("Unexpected bound variable during simplification", expression);
    }

    @Override
    public VisitDecision preorder(DTTMacroExpression expression) {
        this.push(expression);
        DTTExpression[] arguments = this.visit(expression.arguments);
        this.pop(expression);
        this.map(expression, expression.replaceArguments(arguments));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(DTTBindingExpression expression) {
        boolean isLambda = expression.is(DTTLambdaExpression.class);
        boolean modified = false;
        DTTExpression result;
        this.push(expression);
        try (TmpLocals locals = this.context.tmpLocals()) {
            DTTExpression current = expression;
            while (current.getClass() == expression.getClass()) {
                DTTBindingExpression binding = current.to(DTTBindingExpression.class);
                DTTExpression domain = this.context.instantiateRev(binding.domain, locals.asList());
                DTTExpression newDomain = this.visit(domain);
                if (newDomain != domain)
                    modified = true;
                locals.pushLocal(binding.name, newDomain, binding.binderInfo);
                current = binding.body;
            }
            DTTExpression body = this.context.instantiateRev(current, locals.asList());
            DTTExpression newBody = this.visit(body);
            if (newBody != body)
                modified = true;
            if (!modified)
                result = expression;
            else if (isLambda)
                result = locals.mkLambda(newBody);
            else
                result = locals.mkPi(newBody);
        }
        this.pop(expression);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(DTTLetExpression expression) {
        boolean modified = false;
        DTTExpression result;
        this.push(expression);
        try (TmpLocals locals = this.context.tmpLocals()) {
            DTTExpression current = expression;
            while (current.is(DTTLetExpression.class)) {
                DTTLetExpression let = current.to(DTTLetExpression.class);
                DTTExpression type = this.context.instantiateRev(let.type, locals.asList());
                DTTExpression value = this.context.instantiateRev(let.value, locals.asList());
                DTTExpression newType = this.visit(type);
                DTTExpression newValue = this.visit(value);
                if (newType != type || newValue != value)
                    modified = true;
                // The let-local keeps the type and value as written
                locals.pushLet(let.name, type, value);
                current = let.body;
            }
            DTTExpression body = this.context.instantiateRev(current, locals.asList());
            DTTExpression newBody = this.visit(body);
            if (newBody != body)
                modified = true;
            result = modified ? locals.mkLet(newBody) : expression;
        }
        this.pop(expression);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(DTTAppExpression expression) {
        DTTExpression[] arguments = expression.arguments;
        FunInfo info = this.visitInstances ?
                FunInfo.EMPTY : this.funInfo.getFunInfo(expression.function, arguments.length);
        DTTExpression[] newArguments = new DTTExpression[arguments.length];
        this.push(expression);
        for (int i = 0; i < arguments.length; i++) {
            if (i < info.size() && info.get(i).isInstImplicit()) {
                CanonizeResult canonical = this.canonizer.canonize(arguments[i]);
                if (canonical.mutated())
                    this.needRestart = true;
                newArguments[i] = canonical.expression();
            } else {
                newArguments[i] = this.visit(arguments[i]);
            }
        }
        this.pop(expression);
        this.map(expression, expression.replaceArguments(newArguments));
        return VisitDecision.STOP;
    }
}
