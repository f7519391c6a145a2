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

package org.dtt.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.dtt.kernel.errors.InternalKernelError;

import java.util.ArrayList;
import java.util.List;

/** API for producing JSON documents */
public class JsonStream {
    static class Context implements ICastable {
        public int index;
    }

    static class InArray extends Context {}

    static class InObject extends Context {
        public boolean expectLabel = true;
    }

    final List<Context> context = new ArrayList<>();
    private final IIndentStream stream;

    public JsonStream(IIndentStream stream) {
        this.stream = stream;
    }

    public JsonStream append(String string) {
        this.value();
        try {
            string = Utilities.deterministicObjectMapper().writeValueAsString(string);
            this.stream.append(string);
        } catch (JsonProcessingException ex) {
            throw new InternalKernelError("Cannot serialize string " + ex.getMessage());
        }
        return this;
    }

    /** Append the class of the data to the stream */
    public <T> JsonStream appendClass(T data) {
        return this.label("class").append(data.getClass().getSimpleName());
    }

    void value() {
        if (this.context.isEmpty())
            return;
        Context last = Utilities.last(this.context);
        if (last.is(InArray.class)) {
            if (last.index != 0) {
                this.stream.append(",").newline();
            } else {
                this.stream.increase();
            }
            last.index++;
        } else {
            InObject io = last.to(InObject.class);
            if (io.expectLabel)
                throw new InternalKernelError("Missing label");
            io.index++;
            io.expectLabel = true;
        }
    }

    public JsonStream append(int v) {
        this.value();
        this.stream.append(v);
        return this;
    }

    public JsonStream append(long v) {
        this.value();
        this.stream.append(v);
        return this;
    }

    public JsonStream label(String label) {
        Utilities.enforce(!label.isEmpty());
        Context last = Utilities.last(this.context);
        InObject io = last.to(InObject.class,
                "Adding label but not within JsonObject");
        if (!io.expectLabel)
            throw new InternalKernelError("Consecutive labels");
        io.expectLabel = false;
        if (io.index == 0)
            this.stream.increase();
        else
            this.stream.append(",").newline();
        this.stream.appendJsonLabelAndColon(label);
        return this;
    }

    public void beginArray() {
        this.value();
        this.context.add(new InArray());
        this.stream.append("[");
    }

    public JsonStream endArray() {
        Context last = Utilities.removeLast(this.context);
        Utilities.enforce(last.is(InArray.class));
        if (last.index != 0)
            this.stream.newline().decrease();
        this.stream.append("]");
        return this;
    }

    public JsonStream beginObject() {
        this.value();
        this.context.add(new InObject());
        this.stream.append("{");
        return this;
    }

    public void endObject() {
        Context last = Utilities.removeLast(this.context);
        Utilities.enforce(last.is(InObject.class));
        if (last.index != 0)
            this.stream.newline().decrease();
        this.stream.append("}");
    }

    @Override
    public String toString() {
        return this.stream.toString();
    }
}
