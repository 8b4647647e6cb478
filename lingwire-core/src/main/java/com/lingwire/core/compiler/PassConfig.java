package com.lingwire.core.compiler;

import com.lingwire.api.exception.InvalidArgumentException;
import com.lingwire.core.spi.CompilerPass;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Pass 注册表
 * 排序规则：阶段顺序 → 优先级降序 → 注册顺序
 */
public class PassConfig {

    private final List<Entry> entries = new ArrayList<>();

    private long sequence = 0;

    public record Entry(CompilerPass pass, PassStage stage, int priority, long sequence) {
    }

    public void addPass(CompilerPass pass, PassStage stage, int priority) {
        if (pass == null) {
            throw new InvalidArgumentException("pass", "Compiler pass cannot be null");
        }
        entries.add(new Entry(pass, stage != null ? stage : PassStage.BEFORE_OPTIMIZATION, priority, sequence++));
    }

    /**
     * 按执行顺序返回全部 Pass
     */
    public List<Entry> getOrderedEntries() {
        Comparator<Entry> byStage = Comparator.comparing(Entry::stage);
        Comparator<Entry> byPriority = Comparator.comparingInt(Entry::priority);
        List<Entry> ordered = new ArrayList<>(entries);
        ordered.sort(byStage.thenComparing(byPriority.reversed()).thenComparingLong(Entry::sequence));
        return ordered;
    }

    public List<CompilerPass> getPasses() {
        List<CompilerPass> passes = new ArrayList<>();
        for (Entry entry : getOrderedEntries()) {
            passes.add(entry.pass());
        }
        return passes;
    }

    public int size() {
        return entries.size();
    }
}
