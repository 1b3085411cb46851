package me.christianrobert.policyguard.schema.service;

import me.christianrobert.policyguard.TestSchemas;
import me.christianrobert.policyguard.expression.LiteralExpression;
import me.christianrobert.policyguard.policy.exception.InvalidPolicyExpressionException;
import me.christianrobert.policyguard.schema.model.FieldDefinition;
import me.christianrobert.policyguard.schema.model.JoinTableDefinition;
import me.christianrobert.policyguard.schema.model.ManyToManyRelation;
import me.christianrobert.policyguard.schema.model.ModelDefinition;
import me.christianrobert.policyguard.schema.model.PolicyKind;
import me.christianrobert.policyguard.schema.model.PolicyOperation;
import me.christianrobert.policyguard.schema.model.PolicyRule;
import me.christianrobert.policyguard.schema.model.RelationKeys;
import me.christianrobert.policyguard.schema.model.SchemaDefinition;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SchemaBuilderTest {

    @Test
    void buildsModelsWithTablesIdsAndRules() {
        SchemaDefinition schema = TestSchemas.blog();

        ModelDefinition post = schema.requireModel("Post");
        assertEquals("posts", post.getTableName());
        assertEquals("User", schema.requireModel("User").getTableName());
        assertEquals(List.of("id"), post.getIdFields());
        assertEquals(4, post.getRules().size());
        assertEquals("User", schema.getAuthType());
        assertSame(post, schema.findModelByTable("posts"));
        assertNull(schema.findModelByTable("Post"));
    }

    @Test
    void scalarFieldsExcludeRelations() {
        ModelDefinition post = TestSchemas.blog().requireModel("Post");

        List<String> names = post.getScalarFields().stream().map(FieldDefinition::getName).toList();
        assertEquals(List.of("id", "title", "published", "authorId"), names);
    }

    @Test
    void ruleOperationListsAreParsed() {
        PolicyRule rule = TestSchemas.blog().requireModel("Post").getRules().get(1);

        assertEquals(PolicyKind.ALLOW, rule.getKind());
        assertEquals(EnumSet.of(PolicyOperation.CREATE, PolicyOperation.UPDATE), rule.getOperations());
        assertEquals("author == auth()", rule.getSource());
    }

    @Test
    void allNeverIncludesPostUpdate() {
        Set<PolicyOperation> all = PolicyOperation.parseList("all");

        assertEquals(EnumSet.of(PolicyOperation.CREATE, PolicyOperation.READ, PolicyOperation.UPDATE,
                PolicyOperation.DELETE), all);
        assertEquals(EnumSet.of(PolicyOperation.POST_UPDATE, PolicyOperation.READ),
                PolicyOperation.parseList("post-update, read"));
        assertThrows(IllegalArgumentException.class, () -> PolicyOperation.parseList("publish"));
    }

    @Test
    void relationKeysFromOwningSide() {
        RelationKeys keys = TestSchemas.blog().getRelationKeys("Post", "author");

        assertTrue(keys.isOwnedByModel());
        assertEquals("authorId", keys.getKeyPairs().get(0).getFk());
        assertEquals("id", keys.getKeyPairs().get(0).getPk());
    }

    @Test
    void relationKeysFromBackReference() {
        RelationKeys keys = TestSchemas.blog().getRelationKeys("User", "posts");

        assertFalse(keys.isOwnedByModel());
        assertEquals("authorId", keys.getKeyPairs().get(0).getFk());
        assertEquals("id", keys.getKeyPairs().get(0).getPk());
    }

    @Test
    void mixinFieldsAndTheirRulesAreCopiedIntoEveryIncludingModel() {
        SchemaDefinition schema = new SchemaBuilder()
                .type("Audited", t -> t
                        .field("locked", "Boolean", f -> f.deny("update", "locked")))
                .model("Invoice", m -> m.idField("id", "Int").mixin("Audited").allow("all", "true"))
                .model("Order", m -> m.idField("id", "Int").mixin("Audited").allow("all", "true"))
                .build();

        for (String model : List.of("Invoice", "Order")) {
            FieldDefinition locked = schema.requireField(model, "locked");
            assertEquals("Audited", locked.getOriginModel());
            assertEquals(1, locked.getRules().size());
            assertTrue(locked.getRules().get(0).isDeny());
        }
    }

    @Test
    void baseModelContributesFieldsRulesAndIds() {
        SchemaDefinition schema = new SchemaBuilder()
                .model("Asset", m -> m
                        .idField("id", "Int")
                        .field("owner", "String")
                        .allow("read", "true"))
                .model("Video", m -> m
                        .extendsModel("Asset")
                        .field("duration", "Int")
                        .allow("create", "true"))
                .build();

        ModelDefinition video = schema.requireModel("Video");
        assertEquals(List.of("id"), video.getIdFields());
        assertTrue(video.hasField("owner"));
        assertEquals("Asset", video.getField("owner").getOriginModel());
        assertNull(video.getField("duration").getOriginModel());
        assertEquals(2, video.getRules().size());
        assertEquals(new LiteralExpression(true), video.getRules().get(0).getCondition());
    }

    @Test
    void compoundIdOverridesFlaggedFields() {
        SchemaDefinition schema = new SchemaBuilder()
                .model("Membership", m -> m
                        .field("userId", "Int")
                        .field("groupId", "Int")
                        .id("userId", "groupId"))
                .build();

        assertEquals(List.of("userId", "groupId"), schema.requireModel("Membership").getIdFields());
    }

    @Test
    void modelWithoutIdIsRejected() {
        SchemaBuilder builder = new SchemaBuilder().model("Log", m -> m.field("line", "String"));

        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void unknownFieldTypeIsRejected() {
        SchemaBuilder builder = new SchemaBuilder().model("A", m -> m.idField("id", "Int").field("b", "Bogus"));

        IllegalStateException e = assertThrows(IllegalStateException.class, builder::build);
        assertTrue(e.getMessage().contains("Bogus"));
    }

    @Test
    void backReferenceWithoutOwningSideIsRejected() {
        SchemaBuilder builder = new SchemaBuilder()
                .model("Tag", m -> m.idField("id", "Int").toMany("posts", "Article", "tag"))
                .model("Article", m -> m.idField("id", "Int").toOneBackref("tag", "Tag", "posts"));

        IllegalStateException e = assertThrows(IllegalStateException.class, builder::build);
        assertTrue(e.getMessage().contains("owning opposite"), e.getMessage());
    }

    // ========== Many-to-many ==========

    @Test
    void manyToManyJoinTableIsNamedAfterSortedModels() {
        SchemaDefinition schema = TestSchemas.tagging();

        ManyToManyRelation fromTag = schema.getManyToManyRelation("Tag", "articles");
        assertEquals("_ArticleToTag", fromTag.getJoinTable());
        assertEquals("B", fromTag.getParentFk());
        assertEquals("A", fromTag.getOtherFk());
        assertEquals("Article", fromTag.getOtherModel());

        ManyToManyRelation fromArticle = schema.getManyToManyRelation("Article", "tags");
        assertEquals("_ArticleToTag", fromArticle.getJoinTable());
        assertEquals("A", fromArticle.getParentFk());
        assertEquals("B", fromArticle.getOtherFk());

        JoinTableDefinition joinTable = schema.findJoinTable("_ArticleToTag");
        assertEquals("Article", joinTable.getFirstModel());
        assertEquals("Tag", joinTable.getSecondModel());
        assertEquals(1, schema.getJoinTables().size());
        assertNull(schema.findModelByTable("_ArticleToTag"));
    }

    @Test
    void oneToManyIsNotManyToMany() {
        assertNull(TestSchemas.blog().getManyToManyRelation("User", "posts"));
        assertTrue(TestSchemas.blog().getJoinTables().isEmpty());
    }

    @Test
    void namedManyToManyUsesTheRelationName() {
        SchemaDefinition schema = new SchemaBuilder()
                .model("Person", m -> m.idField("id", "Int")
                        .manyToMany("following", "Person", "followers", "Follows")
                        .manyToMany("followers", "Person", "following", "Follows"))
                .build();

        ManyToManyRelation following = schema.getManyToManyRelation("Person", "following");
        assertEquals("_Follows", following.getJoinTable());
        // self-relation: fk order follows the field names
        assertEquals("B", following.getParentFk());
        assertEquals("A", schema.getManyToManyRelation("Person", "followers").getParentFk());
    }

    @Test
    void manyToManyWithMismatchedRelationNamesIsRejected() {
        SchemaBuilder builder = new SchemaBuilder()
                .model("Article", m -> m.idField("id", "Int").manyToMany("tags", "Tag", "articles", "Labels"))
                .model("Tag", m -> m.idField("id", "Int").manyToMany("articles", "Article", "tags"));

        IllegalStateException e = assertThrows(IllegalStateException.class, builder::build);
        assertTrue(e.getMessage().contains("same relation name"), e.getMessage());
    }

    @Test
    void manyToManyRequiresSingleIds() {
        SchemaBuilder builder = new SchemaBuilder()
                .model("Article", m -> m.field("a", "Int").field("b", "Int").id("a", "b")
                        .manyToMany("tags", "Tag", "articles"))
                .model("Tag", m -> m.idField("id", "Int").manyToMany("articles", "Article", "tags"));

        IllegalStateException e = assertThrows(IllegalStateException.class, builder::build);
        assertTrue(e.getMessage().contains("single id"), e.getMessage());
    }

    @Test
    void manyToManyMustPointBack() {
        SchemaBuilder builder = new SchemaBuilder()
                .model("Article", m -> m.idField("id", "Int")
                        .manyToMany("tags", "Tag", "articles")
                        .manyToMany("labels", "Tag", "articles"))
                .model("Tag", m -> m.idField("id", "Int").manyToMany("articles", "Article", "tags"));

        IllegalStateException e = assertThrows(IllegalStateException.class, builder::build);
        assertTrue(e.getMessage().contains("point at each other"), e.getMessage());
    }

    @Test
    void joinTableMayNotClashWithModelTable() {
        SchemaBuilder builder = new SchemaBuilder()
                .model("Article", m -> m.idField("id", "Int").manyToMany("tags", "Tag", "articles"))
                .model("Tag", m -> m.idField("id", "Int").manyToMany("articles", "Article", "tags"))
                .model("Link", m -> m.table("_ArticleToTag").idField("id", "Int"));

        IllegalStateException e = assertThrows(IllegalStateException.class, builder::build);
        assertTrue(e.getMessage().contains("clashes"), e.getMessage());
    }

    @Test
    void typesCannotDeclareModelRules() {
        SchemaBuilder builder = new SchemaBuilder()
                .type("Profile", t -> t.field("bio", "String").allow("read", "true"));

        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void unknownAuthTypeIsRejected() {
        SchemaBuilder builder = new SchemaBuilder()
                .authType("Account")
                .model("A", m -> m.idField("id", "Int"));

        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void invalidPolicyTextNamesItsOwner() {
        SchemaBuilder builder = new SchemaBuilder()
                .model("A", m -> m.idField("id", "Int").allow("read", "x =="));

        InvalidPolicyExpressionException e = assertThrows(InvalidPolicyExpressionException.class, builder::build);
        assertEquals("A", e.getModel());
        assertEquals("x ==", e.getExpression());
    }
}
