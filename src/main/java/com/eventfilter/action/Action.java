package com.eventfilter.action;

import java.util.List;

/**
 * 已保存的 action：任一 step 命中即视为命中。
 */
public record Action(long id, String name, List<ActionStep> steps) {
    public Action {
        steps = List.copyOf(steps);
    }
}
