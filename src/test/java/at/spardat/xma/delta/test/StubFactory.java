/*
 * Copyright (c) 2003, 2007 s IT Solutions AT Spardat GmbH.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a
 * copy of this software and associated documentation files (the "Software"),
 * to deal in the Software without restriction, including without limitation
 * the rights to use, copy, modify, merge, publish, distribute, sublicense,
 * and/or sell copies of the Software, and to permit persons to whom the
 * Software is furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL
 * THE AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING
 * FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS
 * IN THE SOFTWARE.
 *
 */
package at.spardat.xma.delta.test;

import at.spardat.xma.delta.Backend;
import at.spardat.xma.delta.BackendFactory;

/**
 * Creates {@link RecordingBackend}s, or fails the way a backend with a missing library does.
 * Counts how often it was asked.
 */
public class StubFactory implements BackendFactory {

  private final boolean installed;
  private int attempts;

  private StubFactory(boolean installed) {
    this.installed = installed;
  }

  public static StubFactory installed() {
    return new StubFactory(true);
  }

  public static StubFactory missing() {
    return new StubFactory(false);
  }

  public Backend create(String name) {
    attempts++;
    if (!installed) {
      throw new NoClassDefFoundError("backend library for " + name + " is not on the class path");
    }
    return new RecordingBackend(name);
  }

  public int getAttempts() {
    return attempts;
  }
}
