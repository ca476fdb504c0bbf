// file: bench/src/main/java/io/semtree/bench/RandomDocumentGenerator.java
package io.semtree.bench;

import io.semtree.core.TreeNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Seeded generator of synthetic documents and of mutated copies of them.
 *
 * Documents look like a book: sections holding paragraphs of words, with the
 * occasional attribute. Mutations pick uniformly among value edit, sibling swap,
 * insert and delete.
 */
public final class RandomDocumentGenerator {

    private static final String[] WORDS = {
            "alpha", "bravo", "charlie", "delta", "echo", "foxtrot", "golf", "hotel",
            "india", "juliet", "kilo", "lima", "mike", "november", "oscar", "papa",
            "quebec", "romeo", "sierra", "tango", "uniform", "victor", "whiskey", "yankee"
    };

    private final Random rnd;

    public RandomDocumentGenerator(long seed) {
        this.rnd = new Random(seed);
    }

    /**
     * @param sections  number of top-level sections (> 0)
     * @param paragraphs paragraphs per section (> 0)
     */
    public TreeNode document(int sections, int paragraphs) {
        if (sections <= 0) throw new IllegalArgumentException("sections must be > 0");
        if (paragraphs <= 0) throw new IllegalArgumentException("paragraphs must be > 0");

        TreeNode root = TreeNode.of("book");
        for (int s = 0; s < sections; s++) {
            TreeNode section = TreeNode.builder("section")
                    .attribute("id", "s" + s)
                    .child(TreeNode.text("title", sentence(3)))
                    .build();
            for (int p = 0; p < paragraphs; p++) {
                section.addChild(paragraph());
            }
            root.addChild(section);
        }
        return root;
    }

    /** A deep copy of {@code original} with {@code edits} random mutations applied. */
    public TreeNode mutate(TreeNode original, int edits) {
        if (edits < 0) throw new IllegalArgumentException("edits must be >= 0");
        TreeNode copy = original.deepClone();
        for (int i = 0; i < edits; i++) {
            switch (rnd.nextInt(4)) {
                case 0 -> editValue(copy);
                case 1 -> swapSiblings(copy);
                case 2 -> insertParagraph(copy);
                default -> deleteNode(copy);
            }
        }
        return copy;
    }

    private TreeNode paragraph() {
        return TreeNode.builder("para")
                .child(TreeNode.text("text", sentence(4 + rnd.nextInt(8))))
                .build();
    }

    private String sentence(int words) {
        var sb = new StringBuilder();
        for (int i = 0; i < words; i++) {
            if (i > 0) sb.append(' ');
            sb.append(WORDS[rnd.nextInt(WORDS.length)]);
        }
        return sb.toString();
    }

    private void editValue(TreeNode root) {
        List<TreeNode> texts = new ArrayList<>();
        for (TreeNode n : root.preOrder()) {
            if (n.isText()) texts.add(n);
        }
        if (texts.isEmpty()) return;
        TreeNode victim = texts.get(rnd.nextInt(texts.size()));
        victim.parent().replaceChild(victim, TreeNode.text(victim.label(), sentence(5)));
    }

    private void swapSiblings(TreeNode root) {
        List<TreeNode> parents = branches(root, 2);
        if (parents.isEmpty()) return;
        TreeNode parent = parents.get(rnd.nextInt(parents.size()));
        int last = parent.children().size() - 1;
        TreeNode moved = parent.children().get(last);
        parent.removeChild(moved);
        parent.addChild(moved, rnd.nextInt(last));
    }

    private void insertParagraph(TreeNode root) {
        List<TreeNode> sections = root.children();
        if (sections.isEmpty()) {
            root.addChild(paragraph());
            return;
        }
        TreeNode section = sections.get(rnd.nextInt(sections.size()));
        section.addChild(paragraph(), rnd.nextInt(section.children().size() + 1));
    }

    private void deleteNode(TreeNode root) {
        List<TreeNode> candidates = root.descendants();
        if (candidates.isEmpty()) return;
        TreeNode victim = candidates.get(rnd.nextInt(candidates.size()));
        victim.parent().removeChild(victim);
    }

    private static List<TreeNode> branches(TreeNode root, int minChildren) {
        List<TreeNode> out = new ArrayList<>();
        for (TreeNode n : root.preOrder()) {
            if (n.children().size() >= minChildren) out.add(n);
        }
        return out;
    }
}
