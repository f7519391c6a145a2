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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dtt.kernel.errors.InternalKernelError;
import org.dtt.kernel.errors.KernelError;
import org.dtt.kernel.ir.IDTTNode;
import org.dtt.kernel.ir.expression.DTTExpression;
import org.dtt.util.Utilities;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.HashMap;
import java.util.Map;

/** Deserialize data serialized by {@link ToJsonVisitor}.
 * Each class of IR node provides a static fromJson(JsonNode, JsonDecoder) method. */
public class JsonDecoder {
    final Map<Long, IDTTNode> decoded;

    public JsonDecoder() {
        this.decoded = new HashMap<>();
    }

    static final String ROOT = "org.dtt.kernel.ir";
    static final String[] PACKAGES = new String[] { "", "expression" };

    static Class<?> getClass(String simpleName) {
        for (String pack : PACKAGES) {
            String className = ROOT;
            if (!pack.isEmpty())
                className += "." + pack;
            className += "." + simpleName;
            try {
                return Class.forName(className);
            } catch (ClassNotFoundException ignored) {
                // try the next package
            }
        }
        throw new KernelError("Class " + Utilities.singleQuote(simpleName) + " not found");
    }

    <T extends IDTTNode> T lookup(long id, Class<T> clazz) {
        IDTTNode result = this.decoded.get(id);
        if (result == null)
            throw new KernelError("Could not find node with id " + id);
        return result.to(clazz);
    }

    public <T extends IDTTNode> T decode(JsonNode node, Class<T> clazz) {
        Utilities.enforce(node.isObject(), "Expected a JSON object " + node);
        ObjectNode object = (ObjectNode) node;
        JsonNode nodeProp = object.get("node");
        if (nodeProp != null)
            return this.lookup(nodeProp.asLong(), clazz);
        long originalId = Utilities.getLongProperty(node, "id");
        String cls = Utilities.getStringProperty(node, "class");
        Class<?> nodeClass = getClass(cls);
        try {
            Method method = nodeClass.getMethod("fromJson", JsonNode.class, JsonDecoder.class);
            if (!Modifier.isStatic(method.getModifiers()))
                throw new InternalKernelError(cls + ".fromJson is not static");
            IDTTNode result = (IDTTNode) method.invoke(null, node, this);
            Utilities.putNew(this.decoded, originalId, result);
            return result.to(clazz);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof RuntimeException)
                throw (RuntimeException) e.getCause();
            throw new KernelError("Cannot decode " + cls + ": " + e.getCause());
        } catch (NoSuchMethodException | IllegalAccessException e) {
            throw new InternalKernelError("Cannot decode " + cls + ": " + e);
        }
    }

    /** Parse a JSON document produced by {@link ToJsonVisitor}. */
    public static DTTExpression decodeExpression(String json) {
        try {
            JsonNode node = Utilities.deterministicObjectMapper().readTree(json);
            return new JsonDecoder().decode(node, DTTExpression.class);
        } catch (JsonProcessingException e) {
            throw new KernelError("Invalid JSON: " + e.getMessage());
        }
    }
}
