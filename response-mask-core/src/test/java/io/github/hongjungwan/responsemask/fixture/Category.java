package io.github.hongjungwan.responsemask.fixture;

import io.github.hongjungwan.responsemask.api.annotation.MaskWhen;

import java.util.ArrayList;
import java.util.List;

/**
 * 마스킹 테스트 공용 자기 참조 카테고리 트리.
 */
public class Category {

    @MaskWhen(policies = "public")
    private String name;

    @MaskWhen(policies = "flat")
    private List<Category> children = new ArrayList<>();

    public Category() {}

    public Category(String name) {
        this.name = name;
    }

    public Category addChild(Category child) {
        children.add(child);
        return this;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public List<Category> getChildren() { return children; }
    public void setChildren(List<Category> children) { this.children = children; }
}
