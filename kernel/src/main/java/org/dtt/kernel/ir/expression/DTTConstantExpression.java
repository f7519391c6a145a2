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
import org.dtt.util.Linq;
import org.dtt.util.Utilities;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/** A reference to a global declaration, instantiated at some universe levels. */
public final class DTTConstantExpression extends DTTExpression {
    public final String name;
    public final String[] levels;

    public DTTConstantExpression(String name, String... levels) {
        super(0, 1);
        this.name = name;
        this.levels = levels;
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
        DTTConstantExpression o = other.as(DTTConstantExpression.class);
        if (o == null)
            return false;
        return this.name.equals(o.name) && Arrays.equals(this.levels, o.levels);
    }

    @Override
    protected boolean sameStructure(DTTExpression other) {
        return this.sameFields(other);
    }

    @Override
    protected int computeHash() {
        return Objects.hash(this.name, Arrays.hashCode(this.levels));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.name);
        if (this.levels.length > 0)
            builder.append(".{").join(" ", Arrays.asList(this.levels)).append("}");
        return builder;
    }

    @SuppressWarnings("unused")
    public static DTTConstantExpression fromJson(JsonNode node, JsonDecoder decoder) {
        String name = Utilities.getStringProperty(node, "name");
        JsonNode levels = Utilities.getProperty(node, "levels");
        List<String> list = Linq.list(Linq.map(levels.elements(), JsonNode::asText));
        return new DTTConstantExpression(name, list.toArray(new String[0]));
    }
}
