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

package org.dtt.kernel.backend;

import org.dtt.kernel.ir.IDTTNode;
import org.dtt.kernel.ir.expression.DTTBindingExpression;
import org.dtt.kernel.ir.expression.DTTBoundVarExpression;
import org.dtt.kernel.ir.expression.DTTConstantExpression;
import org.dtt.kernel.ir.expression.DTTExpression;
import org.dtt.kernel.ir.expression.DTTLetExpression;
import org.dtt.kernel.ir.expression.DTTLocalExpression;
import org.dtt.kernel.ir.expression.DTTMacroExpression;
import org.dtt.kernel.ir.expression.DTTMetaExpression;
import org.dtt.kernel.ir.expression.DTTSortExpression;
import org.dtt.kernel.visitors.InnerVisitor;
import org.dtt.kernel.visitors.VisitDecision;
import org.dtt.util.IndentStreamBuilder;
import org.dtt.util.JsonStream;

import java.util.HashSet;
import java.util.Set;

/** Serializes an expression as JSON.  A node reachable along several paths
 * is written once; later occurrences are written as {"node": id}.
 * Can be read back with {@link JsonDecoder}. */
public class ToJsonVisitor extends InnerVisitor {
    public final JsonStream stream;
    final Set<Long> serialized;

    public ToJsonVisitor(JsonStream stream) {
        this.stream = stream;
        this.serialized = new HashSet<>();
    }

    public static String toJsonString(DTTExpression expression) {
        JsonStream stream = new JsonStream(new IndentStreamBuilder());
        ToJsonVisitor visitor = new ToJsonVisitor(stream);
        visitor.apply(expression);
        return stream.toString();
    }

    boolean checkDone(IDTTNode node, boolean silent) {
        if (this.serialized.contains(node.getId())) {
            if (silent)
                return true;
            this.stream.beginObject()
                    .label("node")
                    .append(node.getId())
                    .endObject();
            return true;
        }
        return false;
    }

    @Override
    public void startArrayProperty(String property) {
        this.stream.label(property).beginArray();
    }

    @Override
    public void endArrayProperty(String property) {
        this.stream.endArray();
    }

    @Override
    public void property(String name) {
        this.stream.label(name);
    }

    @Override
    public void push(IDTTNode node) {
        if (!this.checkDone(node, true)) {
            this.stream.appendClass(node);
            this.property("id");
            this.stream.append(node.getId());
            this.serialized.add(node.getId());
        }
        super.push(node);
    }

    @Override
    public VisitDecision preorder(IDTTNode node) {
        if (this.checkDone(node, false))
            return VisitDecision.STOP;
        this.stream.beginObject();
        return VisitDecision.CONTINUE;
    }

    @Override
    public void postorder(IDTTNode node) {
        this.stream.endObject();
    }

    @Override
    public void postorder(DTTLocalExpression node) {
        this.property("uniqueName");
        this.stream.append(node.uniqueName);
        this.property("prettyName");
        this.stream.append(node.prettyName);
        this.property("binderInfo");
        this.stream.append(node.binderInfo.name());
        super.postorder(node);
    }

    @Override
    public void postorder(DTTMetaExpression node) {
        this.property("name");
        this.stream.append(node.name);
        super.postorder(node);
    }

    @Override
    public void postorder(DTTSortExpression node) {
        this.property("level");
        this.stream.append(node.level);
        super.postorder(node);
    }

    @Override
    public void postorder(DTTConstantExpression node) {
        this.property("name");
        this.stream.append(node.name);
        this.property("levels");
        this.stream.beginArray();
        for (String level: node.levels)
            this.stream.append(level);
        this.stream.endArray();
        super.postorder(node);
    }

    @Override
    public void postorder(DTTBoundVarExpression node) {
        this.property("index");
        this.stream.append(node.index);
        super.postorder(node);
    }

    @Override
    public void postorder(DTTMacroExpression node) {
        this.property("definition");
        this.stream.append(node.definition);
        super.postorder(node);
    }

    @Override
    public void postorder(DTTBindingExpression node) {
        this.property("name");
        this.stream.append(node.name);
        this.property("binderInfo");
        this.stream.append(node.binderInfo.name());
        super.postorder(node);
    }

    @Override
    public void postorder(DTTLetExpression node) {
        this.property("name");
        this.stream.append(node.name);
        super.postorder(node);
    }
}
