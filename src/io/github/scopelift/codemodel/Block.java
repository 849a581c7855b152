/*
 * Copyright 2026 The Scopelift Authors.
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
package io.github.scopelift.codemodel;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * An ordered, mutable sequence of statements owned by a function or by a statement that nests
 * other statements (the branches of an {@code if}, the body of a loop, ...).
 *
 * <p>Every block has its own handle, so two blocks with the same contents are still told apart.
 * The handle is what "the block a statement belongs to" refers to.
 */
public final class Block implements Iterable<Statement> {
  private static final AtomicInteger nextId = new AtomicInteger();

  private final int id;
  private final String name;
  private final List<Statement> statements = new ArrayList<>();

  public Block(String name) {
    this.id = nextId.incrementAndGet();
    this.name = checkNotNull(name);
  }

  public Block(String name, List<Statement> statements) {
    this(name);
    for (Statement statement : statements) {
      add(statement);
    }
  }

  /** The unique handle of this block. */
  public int getId() {
    return id;
  }

  /** What the block is to its owner: "body", "then", "else", "catch", ... */
  public String getName() {
    return name;
  }

  public int size() {
    return statements.size();
  }

  public boolean isEmpty() {
    return statements.isEmpty();
  }

  public Statement get(int index) {
    return statements.get(index);
  }

  /**
   * Returns the position of {@code statement} in this block, comparing handles, or -1 if it is
   * not a member.
   */
  public int indexOf(Statement statement) {
    for (int i = 0; i < statements.size(); i++) {
      if (statements.get(i).getId() == statement.getId()) {
        return i;
      }
    }
    return -1;
  }

  public void add(Statement statement) {
    statements.add(checkNotNull(statement));
  }

  public void addFirst(Statement statement) {
    statements.add(0, checkNotNull(statement));
  }

  /** Replaces the statement at {@code index}, returning the one that was there. */
  public Statement set(int index, Statement statement) {
    return statements.set(index, checkNotNull(statement));
  }

  /** A snapshot of the current statements. */
  public ImmutableList<Statement> getStatements() {
    return ImmutableList.copyOf(statements);
  }

  @Override
  public Iterator<Statement> iterator() {
    return Iterators.unmodifiableIterator(statements.iterator());
  }

  /** Renders the statements separated by spaces, without surrounding braces. */
  @Override
  public String toString() {
    return Joiner.on(' ').join(statements);
  }

  /** Renders the block as a braced body. */
  String toBracedString() {
    return statements.isEmpty() ? "{}" : "{ " + this + " }";
  }
}
