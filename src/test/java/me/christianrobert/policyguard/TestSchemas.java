package me.christianrobert.policyguard;

import me.christianrobert.policyguard.schema.model.SchemaDefinition;
import me.christianrobert.policyguard.schema.service.SchemaBuilder;

import java.util.List;

/**
 * Schemas shared by the unit tests.
 */
public final class TestSchemas {

    private TestSchemas() {
    }

    /**
     * User / Post / Comment blog schema. {@code User} is the auth type.
     * <ul>
     *   <li>User: readable by everyone, email only by the user themselves</li>
     *   <li>Post: readable when published or owned, writable by the author, never deletable while published</li>
     *   <li>Comment: readable when the post is readable</li>
     * </ul>
     */
    public static SchemaDefinition blog() {
        return new SchemaBuilder()
                .authType("User")
                .model("User", m -> m
                        .idField("id", "Int")
                        .field("email", "String", f -> f.allow("read", "auth() == this"))
                        .field("role", "String")
                        .field("tags", "String", f -> f.array())
                        .toMany("posts", "Post", "author")
                        .allow("read", "true")
                        .allow("create,update,delete", "auth() == this"))
                .model("Post", m -> m
                        .table("posts")
                        .idField("id", "Int")
                        .field("title", "String")
                        .field("published", "Boolean")
                        .field("authorId", "Int")
                        .toOne("author", "User", List.of("authorId"), List.of("id"))
                        .toMany("comments", "Comment", "post")
                        .allow("read", "published || author == auth()")
                        .allow("create,update", "author == auth()")
                        .allow("delete", "author == auth()")
                        .deny("delete", "published"))
                .model("Comment", m -> m
                        .idField("id", "Int")
                        .field("content", "String")
                        .field("postId", "Int")
                        .field("authorId", "Int")
                        .toOne("post", "Post", List.of("postId"), List.of("id"))
                        .toOne("author", "User", List.of("authorId"), List.of("id"))
                        .allow("read", "check(post)")
                        .allow("create", "auth() != null"))
                .build();
    }

    /**
     * Single-table schema {@code Foo{id, x}} with a constant allow-all read rule.
     */
    public static SchemaDefinition foo(String updateCondition) {
        return new SchemaBuilder()
                .model("Foo", m -> m
                        .idField("id", "Int")
                        .field("x", "Int")
                        .allow("read,create", "true")
                        .allow("update", updateCondition))
                .build();
    }

    /**
     * Article / Tag linked through the implicit join table {@code _ArticleToTag} (A = Article, B = Tag).
     * Articles are readable when published and updatable by any signed-in user, tags are readable by
     * everyone and updatable while unlocked.
     */
    public static SchemaDefinition tagging() {
        return new SchemaBuilder()
                .model("Article", m -> m
                        .idField("id", "Int")
                        .field("title", "String")
                        .field("published", "Boolean")
                        .manyToMany("tags", "Tag", "articles")
                        .allow("read", "published")
                        .allow("update", "auth() != null"))
                .model("Tag", m -> m
                        .idField("id", "Int")
                        .field("name", "String")
                        .field("locked", "Boolean")
                        .manyToMany("articles", "Article", "tags")
                        .allow("read", "true")
                        .allow("update", "locked == false"))
                .build();
    }

    /**
     * Self-referencing {@code Emp{id, name, managerId}}: an employee is readable when their manager is
     * named "boss".
     */
    public static SchemaDefinition staff() {
        return new SchemaBuilder()
                .model("Emp", m -> m
                        .idField("id", "Int")
                        .field("name", "String")
                        .field("managerId", "Int", f -> f.optional())
                        .optionalToOne("manager", "Emp", List.of("managerId"), List.of("id"))
                        .toMany("reports", "Emp", "manager")
                        .allow("read", "manager.name == 'boss'"))
                .build();
    }
}
