/*
 * Copyright 2026 Google Inc. All Rights Reserved.
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

package com.google.sdl.parse;

import static com.google.common.base.Preconditions.checkState;
import static com.google.common.base.Verify.verify;

import com.google.common.collect.ImmutableList;
import com.google.sdl.diag.Span;
import com.google.sdl.tree.Node;
import com.google.sdl.tree.NodeKind;
import com.google.sdl.tree.SyntaxElement;
import com.google.sdl.tree.SyntaxToken;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Records the nodes recognized by the parser as token ranges, and assembles them into a tree.
 *
 * <p>Markers are kept in preorder: a marker is opened before any marker nested inside it, and
 * {@link Marker#precede} inserts a wrapper in front of an already completed marker. A marker
 * covers the tokens from its start to the last token consumed before it was completed, so trivia
 * before the first and after the last significant token is attached to an enclosing node.
 */
final class EventSink {

  private final TokenCursor cursor;
  private final List<Marker> markers = new ArrayList<>();

  EventSink(TokenCursor cursor) {
    this.cursor = cursor;
  }

  /** Opens a marker at the current token. */
  Marker start() {
    return start(cursor.index());
  }

  /** Opens a marker at the given token index. */
  Marker start(int tokenIndex) {
    Marker marker = new Marker(tokenIndex);
    markers.add(marker);
    return marker;
  }

  /** The current state, for a later {@link #rollback}. */
  int checkpoint() {
    return markers.size();
  }

  /** Discards every marker opened since the checkpoint was taken. */
  void rollback(int checkpoint) {
    markers.subList(checkpoint, markers.size()).clear();
  }

  /** A node under construction. */
  final class Marker {

    private final int start;
    private int end = -1;
    private @Nullable NodeKind kind;
    private boolean abandoned;

    private Marker(int start) {
      this.start = start;
    }

    /** Completes the node at the last consumed token. A node without tokens is dropped. */
    void done(NodeKind kind) {
      done(kind, cursor.lastConsumed() + 1);
    }

    /** Completes the node at the given (exclusive) token index. */
    void done(NodeKind kind, int end) {
      checkState(this.kind == null && !abandoned, "marker already completed");
      if (end <= start) {
        abandoned = true;
        return;
      }
      this.kind = kind;
      this.end = end;
    }

    /**
     * Opens a new marker that starts where this one does, and will enclose it. Only this marker's
     * descendants follow it in the list, so the search from the end is short.
     */
    Marker precede() {
      Marker outer = new Marker(start);
      int idx = markers.lastIndexOf(this);
      verify(idx >= 0, "marker is not live");
      markers.add(idx, outer);
      return outer;
    }
  }

  /** Builds the tree. The first live marker must be the root, and cover every token. */
  Node build() {
    ImmutableList<SyntaxToken> tokens = cursor.tokens();
    List<Marker> live = new ArrayList<>();
    for (Marker marker : markers) {
      if (marker.abandoned) {
        continue;
      }
      verify(marker.kind != null, "unfinished marker at token %s", marker.start);
      live.add(marker);
    }
    verify(!live.isEmpty());
    Marker root = live.get(0);
    verify(root.start == 0 && root.end == tokens.size(), "root does not cover the input");
    return new Builder(tokens, live).node(root);
  }

  private static final class Builder {
    private final ImmutableList<SyntaxToken> tokens;
    private final List<Marker> live;
    private int next = 1;

    Builder(ImmutableList<SyntaxToken> tokens, List<Marker> live) {
      this.tokens = tokens;
      this.live = live;
    }

    Node node(Marker marker) {
      ImmutableList.Builder<SyntaxElement> children = ImmutableList.builder();
      int tok = marker.start;
      while (next < live.size() && live.get(next).start < marker.end) {
        Marker child = live.get(next++);
        verify(
            child.start >= tok && child.end <= marker.end,
            "%s [%s, %s) is not nested in %s [%s, %s)",
            child.kind,
            child.start,
            child.end,
            marker.kind,
            marker.start,
            marker.end);
        children.addAll(tokens.subList(tok, child.start));
        children.add(node(child));
        tok = child.end;
      }
      children.addAll(tokens.subList(tok, marker.end));
      Span first = tokens.get(marker.start).span();
      Span last = tokens.get(marker.end - 1).span();
      Span span =
          new Span(
              first.start(),
              last.end(),
              first.startLine(),
              first.startColumn(),
              last.endLine(),
              last.endColumn());
      return new Node(marker.kind, children.build(), span);
    }
  }
}
