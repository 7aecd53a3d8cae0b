package io.cflow.parser;

import org.treesitter.TSNode;
import org.treesitter.TSTree;

import java.nio.file.Path;

/**
 * A parsed Python file. Holds on to the tree so its nodes stay valid while
 * the extractor walks them.
 *
 * @param file   The file path
 * @param source The text the tree was parsed from
 * @param tree   The syntax tree
 */
public record ParsedModule(Path file, SourceText source, TSTree tree) {

    public TSNode root() {
        return tree.getRootNode();
    }
}
