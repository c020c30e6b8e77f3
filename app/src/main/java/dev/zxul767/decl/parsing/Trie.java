package dev.zxul767.decl.parsing;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

// Maps literal character sequences to values and answers longest-prefix
// queries against an input string.
public class Trie<V> {
  public static class Match<V> {
    public final V value;
    // number of chars of the input covered by the match
    public final int length;

    Match(V value, int length) {
      this.value = value;
      this.length = length;
    }

    @Override
    public String toString() {
      return String.format("%s (%d)", value, length);
    }
  }

  private static class Node<V> {
    final Map<Character, Node<V>> edges = new HashMap<>();
    // null unless a registered sequence ends at this node
    V value;
  }

  private final Node<V> root = new Node<>();

  public Trie<V> insert(String sequence, V value) {
    if (sequence == null || sequence.isEmpty())
      throw new IllegalArgumentException("cannot register an empty sequence");
    if (value == null)
      throw new IllegalArgumentException("cannot register a null value");

    Node<V> node = root;
    for (int i = 0; i < sequence.length(); i++) {
      node = node.edges.computeIfAbsent(sequence.charAt(i), c -> new Node<>());
    }
    node.value = value;
    return this;
  }

  public Optional<Match<V>> longestMatch(String input) {
    return longestMatch(input, 0);
  }

  // returns the longest registered sequence that is a prefix of
  // `input.substring(from)`, if any
  public Optional<Match<V>> longestMatch(String input, int from) {
    Match<V> best = null;
    Node<V> node = root;
    for (int i = from; i < input.length(); i++) {
      node = node.edges.get(input.charAt(i));
      if (node == null)
        break;
      if (node.value != null)
        best = new Match<>(node.value, i - from + 1);
    }
    return Optional.ofNullable(best);
  }
}
