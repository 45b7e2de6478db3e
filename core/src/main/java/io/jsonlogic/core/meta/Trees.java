package io.jsonlogic.core.meta;

import java.util.ArrayList;
import java.util.List;

/** Box-drawing layout shared by the {@link RuleNode} renderings. */
final class Trees {

    private Trees() {}

    static List<String> branch(String label, List<RuleNode> children) {
        List<String> lines = new ArrayList<>();
        lines.add(label);
        for (int i = 0; i < children.size(); i++) {
            boolean last = i == children.size() - 1;
            List<String> child = children.get(i).lines();
            lines.add((last ? "  └─ " : "  ├─ ") + child.get(0));
            String continuation = last ? "     " : "  │  ";
            for (String line : child.subList(1, child.size())) {
                lines.add(continuation + line);
            }
        }
        return lines;
    }
}
