/*
 * Copyright 2025 The Typeblocks Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.typeblocks.impl;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.typeblocks.types.TypeTerm;

/**
 * A statement defining a record type. It declares a compound binder for the type, whose term is a
 * {@link TypeTerm.Record}, with one component binder per field; all of them are visible in the
 * statements that follow (i.e. in NEXT).
 *
 * <p>Fields can be added, removed, renamed, and retyped; each change rebuilds the record's type and
 * re-infers whatever depends on it.
 */
public final class RecordDefinitionNode extends Node {

  private final Binder record;

  public RecordDefinitionNode(Workspace workspace, String name, String... fieldNames) {
    super(workspace, "record");
    setPrevious();
    addNext();
    record = declare("NEXT", new TypeTerm.Record(List.of(), List.of()), name);
    for (String fieldName : fieldNames) {
      addField(fieldName);
    }
    rebuild();
  }

  /** The binder for the record type. */
  public Binder record() {
    return record;
  }

  /** The binders for the fields, in order. */
  public ImmutableList<Binder> fields() {
    return record.children();
  }

  public int numFields() {
    return record.children.size();
  }

  private void addField(String fieldName) {
    Preconditions.checkArgument(!hasField(fieldName), "Duplicate field %s", fieldName);
    workspace.newChildBinder(record, newVariable(), fieldName);
  }

  private boolean hasField(String fieldName) {
    return record.children.stream().anyMatch(b -> b.name().equals(fieldName));
  }

  /**
   * Adds fields (with generated names and unconstrained types) or removes fields from the end so
   * that there are {@code n}; the remaining fields are unchanged.
   */
  public void resizeFields(int n) {
    Preconditions.checkArgument(n >= 0);
    while (numFields() < n) {
      String fieldName = "field" + numFields();
      for (int i = 0; hasField(fieldName); i++) {
        fieldName = "field" + numFields() + "_" + i;
      }
      addField(fieldName);
    }
    while (numFields() > n) {
      Binder removed = record.children.get(numFields() - 1);
      workspace.disposeBinder(removed);
      // A field that is still referenced is pending deletion but no longer part of the type
      workspace.directory().detachChild(removed);
    }
    update();
  }

  /** Sets the declared type of field {@code i}. */
  public void setFieldType(int i, TypeTerm type) {
    record.children.get(i).replaceTerm(type);
    update();
  }

  @Override
  boolean canRenameBinder(Binder binder, String newName) {
    return binder == record || binder.name().equals(newName) || !hasField(newName);
  }

  @Override
  void binderRenamed(Binder binder) {
    super.binderRenamed(binder);
    if (binder != record) {
      update();
    }
  }

  @Override
  Iterable<Binder> bindersVisibleIn(Connection input) {
    List<Binder> result = new ArrayList<>();
    if (input.name.equals("NEXT")) {
      result.add(record);
      result.addAll(record.children);
    }
    return result;
  }

  @Override
  public String defaultScopeInput() {
    return "NEXT";
  }

  private void rebuild() {
    List<String> names = new ArrayList<>();
    List<TypeTerm> types = new ArrayList<>();
    for (Binder field : record.children) {
      names.add(field.name());
      types.add(field.term());
    }
    record.replaceTerm(new TypeTerm.Record(names, types));
  }

  private void update() {
    rebuild();
    TypeInference.reinferLeniently(workspace.context, List.of(this));
  }
}
