package com.vidnyan.semacro.adapter.in.cli;

import com.vidnyan.semacro.domain.expansion.ExpansionNode;

import java.util.List;
import java.util.StringJoiner;

/**
 * Renders expansion trees with box-drawing connectors.
 *
 * <pre>
 * files_pid_filetrans(ntpd_t, ntpd_var_run_t, file)
 * ├── allow ntpd_t var_t:dir { getattr search open };
 * └── filetrans_pattern(ntpd_t, var_run_t, ntpd_var_run_t, file)
 *     └── type_transition ntpd_t var_run_t:file ntpd_var_run_t;
 * </pre>
 */
public class TreeRenderer {

    static final String BOLD = "\033[1m";
    static final String DIM = "\033[2m";
    static final String YELLOW = "\033[33m";
    static final String CYAN = "\033[36m";
    static final String RESET = "\033[0m";

    private final boolean color;

    public TreeRenderer(boolean color) {
        this.color = color;
    }

    public String render(ExpansionNode root) {
        StringJoiner out = new StringJoiner("\n");
        out.add(colored(root.text(), BOLD, CYAN));
        renderChildren(root.children(), "", out);
        return out.toString();
    }

    private void renderChildren(List<ExpansionNode> children, String prefix, StringJoiner out) {
        for (int i = 0; i < children.size(); i++) {
            ExpansionNode child = children.get(i);
            boolean last = i == children.size() - 1;
            out.add(prefix + (last ? "└── " : "├── ") + label(child));
            renderChildren(child.children(), prefix + (last ? "    " : "│   "), out);
        }
    }

    private String label(ExpansionNode node) {
        return switch (node.kind()) {
            case MACRO -> colored(node.text(), BOLD, YELLOW);
            case RULE, UNRESOLVED -> node.text();
            case DEPTH_LIMIT, CYCLE -> colored(node.text(), DIM);
        };
    }

    public String colored(String text, String... codes) {
        if (!color) {
            return text;
        }
        return String.join("", codes) + text + RESET;
    }
}
