/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.optim.type;

/** What a {@link Field} holds. Decided when the field is declared, so the
 * tree walks never need to guess from the runtime value. */
public enum FieldKind {
  /** A single storage leaf. */
  STORAGE(true, false),
  /** An ordered list of storage leaves that share one role. */
  STORAGE_LIST(true, true),
  /** A single nested {@link Struct}. */
  COMPOSITE(false, false),
  /** An ordered list whose elements are {@link Struct}s or, recursively,
   * lists of them. */
  COMPOSITE_LIST(false, true),
  /** Data that the tree walks copy but never look into. */
  PLAIN(false, false);

  public final boolean storage;
  public final boolean list;

  FieldKind(boolean storage, boolean list) {
    this.storage = storage;
    this.list = list;
  }

  /** Returns whether values of this kind are walked recursively. */
  public boolean isComposite() {
    return this == COMPOSITE || this == COMPOSITE_LIST;
  }
}

// End FieldKind.java
