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

package org.dtt.kernel.ir.expression;

import com.fasterxml.jackson.databind.JsonNode;
import org.dtt.kernel.backend.JsonDecoder;
import org.dtt.kernel.ir.IDTTNode;
import org.dtt.kernel.visitors.InnerVisitor;
import org.dtt.kernel.visitors.VisitDecision;
import org.dtt.util.IIndentStream;
import org.dtt.util.Utilities;

import javax.annotation.Nullable;
import java.util.Objects;

/** A metavariable.  In the left-hand side of a rewrite rule metavariables act as pattern variables. */
public final class DTTMetaExpression extends DTTExpression {
    public final String name;
    @Nullable
    public final DTTExpression type;

    public DTTMetaExpression(String name, @Nullable DTTExpression type) {
        super(0, 1);
        this.name = name;
        this.type = type;
    }

    public DTTMetaExpression(String name) {
        this(name, null);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        if (this.type != null) {
            visitor.property("type");
            this.type.accept(visitor);
        }
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IDTTNode other) {
        DTTMetaExpression o = other.as(DTTMetaExpression.class);
        if (o == null)
            return false;
        return this.name.equals(o.name) && this.type == o.type;
    }

    @Override
    protected boolean sameStructure(DTTExpression other) {
        DTTMetaExpression o = other.to(DTTMetaExpression.class);
        return this.name.equals(o.name) && Objects.equals(this.type, o.type);
    }

    @Override
    protected int computeHash() {
        return Objects.hash("?", this.name);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("?").append(this.name);
    }

    @SuppressWarnings("unused")
    public static DTTMetaExpression fromJson(JsonNode node, JsonDecoder decoder) {
        String name = Utilities.getStringProperty(node, "name");
        DTTExpression type = null;
        if (node.has("type"))
            type = fromJsonInner(node, "type", decoder, DTTExpression.class);
        return new DTTMetaExpression(name, type);
    }
}
