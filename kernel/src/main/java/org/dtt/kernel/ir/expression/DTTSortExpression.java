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

import java.util.Objects;

/** A universe.  The level is kept symbolic. */
public final class DTTSortExpression extends DTTExpression {
    public final String level;

    public static final DTTSortExpression PROP = new DTTSortExpression("0");
    public static final DTTSortExpression TYPE = new DTTSortExpression("1");

    public DTTSortExpression(String level) {
        super(0, 1);
        this.level = level;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IDTTNode other) {
        DTTSortExpression o = other.as(DTTSortExpression.class);
        if (o == null)
            return false;
        return this.level.equals(o.level);
    }

    @Override
    protected boolean sameStructure(DTTExpression other) {
        return this.sameFields(other);
    }

    @Override
    protected int computeHash() {
        return Objects.hash("Sort", this.level);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("Sort ").append(this.level);
    }

    @SuppressWarnings("unused")
    public static DTTSortExpression fromJson(JsonNode node, JsonDecoder decoder) {
        return new DTTSortExpression(Utilities.getStringProperty(node, "level"));
    }
}
