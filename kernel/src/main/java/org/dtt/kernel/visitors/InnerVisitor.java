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

import org.dtt.kernel.errors.InternalKernelError;
import org.dtt.kernel.ir.IDTTNode;
import org.dtt.kernel.ir.expression.DTTAppExpression;
import org.dtt.kernel.ir.expression.DTTBindingExpression;
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
import org.dtt.util.IHasId;
import org.dtt.util.IWritesLogs;
import org.dtt.util.Logger;
import org.dtt.util.Utilities;

import java.util.ArrayList;
import java.util.List;

/**
 * Depth-first visitor for expressions.
 * The preorder methods of a class delegate to the preorder method of the superclass,
 * so a visitor can override only the most general method it cares about. */
public abstract class InnerVisitor implements IRTransform, IWritesLogs, IHasId {
    final long id;
    static long crtId = 0;
    protected final List<IDTTNode> context;

    protected InnerVisitor() {
        this.id = crtId++;
        this.context = new ArrayList<>();
    }

    @Override
    public long getId() {
        return this.id;
    }

    public void push(IDTTNode node) {
        this.context.add(node);
    }

    public void pop(IDTTNode node) {
        IDTTNode last = Utilities.removeLast(this.context);
        if (node != last)
            throw new InternalKernelError("Corrupted visitor context: popping " + node
                    + " instead of " + last, node);
    }

    /** Override to initialize before visiting any node. */
    public void startVisit(IDTTNode node) {
        Logger.INSTANCE.belowLevel(this, 4)
                .append("Starting ")
                .appendSupplier(this::toString)
                .append(" at ")
                .append(node)
                .newline();
    }

    /** Override to finish after visiting all nodes. */
    public void endVisit() {}

    /** Called by nodes before visiting the child stored in field 'name'. */
    @SuppressWarnings("unused")
    public void property(String name) {}

    /** Called by nodes before visiting the children stored in an array field. */
    @SuppressWarnings("unused")
    public void startArrayProperty(String name) {}

    @SuppressWarnings("unused")
    public void endArrayProperty(String name) {}

    @Override
    public DTTExpression apply(DTTExpression expression) {
        this.startVisit(expression);
        expression.accept(this);
        this.endVisit();
        return expression;
    }

    /************************* PREORDER *****************************/

    // preorder methods return CONTINUE when normal traversal is desired,
    // and STOP when the traversal should not visit the children of the current node.
    public VisitDecision preorder(IDTTNode ignored) {
        return VisitDecision.CONTINUE;
    }

    public VisitDecision preorder(DTTExpression node) {
        return this.preorder((IDTTNode) node);
    }

    public VisitDecision preorder(DTTLocalExpression node) {
        return this.preorder((DTTExpression) node);
    }

    public VisitDecision preorder(DTTMetaExpression node) {
        return this.preorder((DTTExpression) node);
    }

    public VisitDecision preorder(DTTSortExpression node) {
        return this.preorder((DTTExpression) node);
    }

    public VisitDecision preorder(DTTConstantExpression node) {
        return this.preorder((DTTExpression) node);
    }

    public VisitDecision preorder(DTTBoundVarExpression node) {
        return this.preorder((DTTExpression) node);
    }

    public VisitDecision preorder(DTTMacroExpression node) {
        return this.preorder((DTTExpression) node);
    }

    public VisitDecision preorder(DTTBindingExpression node) {
        return this.preorder((DTTExpression) node);
    }

    public VisitDecision preorder(DTTLambdaExpression node) {
        return this.preorder((DTTBindingExpression) node);
    }

    public VisitDecision preorder(DTTPiExpression node) {
        return this.preorder((DTTBindingExpression) node);
    }

    public VisitDecision preorder(DTTLetExpression node) {
        return this.preorder((DTTExpression) node);
    }

    public VisitDecision preorder(DTTAppExpression node) {
        return this.preorder((DTTExpression) node);
    }

    /************************* POSTORDER *****************************/

    @SuppressWarnings("EmptyMethod")
    public void postorder(IDTTNode ignored) {}

    public void postorder(DTTExpression node) {
        this.postorder((IDTTNode) node);
    }

    public void postorder(DTTLocalExpression node) {
        this.postorder((DTTExpression) node);
    }

    public void postorder(DTTMetaExpression node) {
        this.postorder((DTTExpression) node);
    }

    public void postorder(DTTSortExpression node) {
        this.postorder((DTTExpression) node);
    }

    public void postorder(DTTConstantExpression node) {
        this.postorder((DTTExpression) node);
    }

    public void postorder(DTTBoundVarExpression node) {
        this.postorder((DTTExpression) node);
    }

    public void postorder(DTTMacroExpression node) {
        this.postorder((DTTExpression) node);
    }

    public void postorder(DTTBindingExpression node) {
        this.postorder((DTTExpression) node);
    }

    public void postorder(DTTLambdaExpression node) {
        this.postorder((DTTBindingExpression) node);
    }

    public void postorder(DTTPiExpression node) {
        this.postorder((DTTBindingExpression) node);
    }

    public void postorder(DTTLetExpression node) {
        this.postorder((DTTExpression) node);
    }

    public void postorder(DTTAppExpression node) {
        this.postorder((DTTExpression) node);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + "#" + this.id;
    }
}
