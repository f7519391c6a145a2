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

package org.dtt.kernel.ir;

import com.fasterxml.jackson.databind.JsonNode;
import org.dtt.kernel.backend.JsonDecoder;
import org.dtt.util.IndentStreamBuilder;
import org.dtt.util.Linq;
import org.dtt.util.Utilities;

import java.util.List;

/** Base class for all kernel IR nodes. */
public abstract class DTTNode implements IDTTNode {
    static long crtId = 0;
    public final long id;

    protected DTTNode() {
        synchronized (DTTNode.class) {
            this.id = crtId++;
        }
    }

    @Override
    public long getId() {
        return this.id;
    }

    @Override
    public String toString() {
        IndentStreamBuilder stream = new IndentStreamBuilder();
        this.toString(stream);
        return stream.toString();
    }

    public static <T extends IDTTNode> T fromJsonInner(
            JsonNode node, String property, JsonDecoder decoder, Class<T> clazz) {
        JsonNode prop = Utilities.getProperty(node, property);
        return decoder.decode(prop, clazz);
    }

    public static <T extends IDTTNode> List<T> fromJsonInnerList(
            JsonNode node, String property, JsonDecoder decoder, Class<T> clazz) {
        JsonNode prop = Utilities.getProperty(node, property);
        Utilities.enforce(prop.isArray(), "Node is not an array " + prop);
        return Linq.list(Linq.map(prop.elements(), e -> decoder.decode(e, clazz)));
    }
}
