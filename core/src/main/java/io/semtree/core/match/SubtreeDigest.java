// file: core/src/main/java/io/semtree/core/match/SubtreeDigest.java
package io.semtree.core.match;

import io.semtree.core.AttributeComparator;
import io.semtree.core.TreeNode;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Merkle-style content digest of a whole subtree, SHA-256.
 * <p>
 * Leaf/branch hash = H(label || value || attributes || childHash1 || childHash2 || ...),
 * every string part length-prefixed so that concatenations cannot collide.
 * Attributes go through the {@link AttributeComparator} canonical form, so with
 * attribute order ignored two reordered maps digest the same.
 * <p>
 * Equal digests mean equal subtrees for our purposes. Digests depend on the
 * comparator, so they are cached per instance (one instance per matcher run),
 * never on the nodes.
 */
final class SubtreeDigest {
    private final AttributeComparator attributes;
    private final Map<TreeNode, byte[]> cache = new IdentityHashMap<>();

    SubtreeDigest(AttributeComparator attributes) {
        this.attributes = attributes;
    }

    byte[] of(TreeNode node) {
        byte[] d = cache.get(node);
        if (d != null) return d;

        MessageDigest md = newDigest();
        update(md, node.label());
        if (node.hasValue()) {
            md.update((byte) 1);
            update(md, node.value());
        } else {
            md.update((byte) 0);
        }
        var canonical = attributes.canonical(node.attributes());
        md.update(intBE(canonical.size()));
        for (var e : canonical) {
            update(md, e.getKey());
            update(md, e.getValue());
        }
        md.update(intBE(node.children().size()));
        for (TreeNode c : node.children()) {
            md.update(of(c));
        }
        d = md.digest();
        cache.put(node, d);
        return d;
    }

    private static void update(MessageDigest md, String s) {
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        md.update(intBE(b.length));
        md.update(b);
    }

    private static byte[] intBE(int v) {
        return ByteBuffer.allocate(4).order(ByteOrder.BIG_ENDIAN).putInt(v).array();
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
