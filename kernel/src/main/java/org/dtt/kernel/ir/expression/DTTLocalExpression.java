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
import org.dtt.kernel.ir.BinderInfo;
import org.dtt.kernel.ir.IDTTNode;
import org.dtt.kernel.visitors.InnerVisitor;
import org.dtt.kernel.visitors.VisitDecision;
import org.dtt.util.IIndentStream;
import org.dtt.util.Utilities;

/**
 * A free variable in locally-nameless form.  Locals are created by the
 * type context when descending under binders; two locals are the same
 * variable when they have the same unique name. */
public final class DTTLocalExpression extends DTTExpression {
    public final String uniqueName;
    public final String prettyName;
    public final DTTExpression type;
    public final BinderInfo binderInfo;

    public DTTLocalExpression(String uniqueName, String prettyName, DTTExpression type, BinderInfo binderInfo) {
        super(0, 1);
        Utilities.enforce(!type.hasLooseBVars(), "Type of local " + prettyName + " has loose bound variables");
        this.uniqueName = uniqueName;
        this.prettyName = prettyName;
        this.type = type;
        this.binderInfo = binderInfo;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("type");
        this.type.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IDTTNode other) {
        DTTLocalExpression o = other.as(DTTLocalExpression.class);
        if (o == null)
            return false;
        return this.uniqueName.equals(o.uniqueName) && this.type == o.type;
    }

    @Override
    protected boolean sameStructure(DTTExpression other) {
        return this.uniqueName.equals(other.to(DTTLocalExpression.class).uniqueName);
    }

    @Override
    protected int computeHash() {
        return this.uniqueName.hashCode();
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.prettyName);
    }

    @SuppressWarnings("unused")
    public static DTTLocalExpression fromJson(JsonNode node, JsonDecoder decoder) {
        String uniqueName = Utilities.getStringProperty(node, "uniqueName");
        String prettyName = Utilities.getStringProperty(node, "prettyName");
        DTTExpression type = fromJsonInner(node, "type", decoder, DTTExpression.class);
        BinderInfo info = BinderInfo.valueOf(Utilities.getStringProperty(node, "binderInfo"));
        return new DTTLocalExpression(uniqueName, prettyName, type, info);
    }
}
