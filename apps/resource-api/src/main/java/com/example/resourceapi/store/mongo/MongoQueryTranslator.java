package com.example.resourceapi.store.mongo;

import com.example.resourceapi.scroll.QueryPlan;
import com.example.resourceapi.scroll.ScrollPosition;
import com.example.resourceapi.scroll.SortOrder;
import com.example.resourceapi.store.DocumentFields;
import org.bson.types.BSONTimestamp;
import org.bson.types.Binary;
import org.bson.types.ObjectId;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Translates a {@link QueryPlan} into a MongoDB {@link Query}.
 *
 * <p>Continuation uses the keyset form {@code (f > v) or (f == v and _id > id)} for ascending order and
 * the mirrored form for descending order. Null and missing values sort before every other value in
 * ascending order, so they need their own branches, and so do values of other BSON types.
 */
final class MongoQueryTranslator {

    // BSON type codes grouped in MongoDB's cross-type sort order, after null and missing values
    private static final List<int[]> TYPE_BRACKETS = List.of(
            new int[] {1, 16, 18, 19}, // double, int, long, decimal
            new int[] {2, 14},         // string, symbol
            new int[] {3},             // object
            new int[] {4},             // array
            new int[] {5},             // binary
            new int[] {7},             // objectId
            new int[] {8},             // boolean
            new int[] {9},             // date
            new int[] {17},            // timestamp
            new int[] {11});           // regex

    private MongoQueryTranslator() {}

    static Query toQuery(QueryPlan plan) {
        List<Criteria> parts = new ArrayList<>();
        if (plan.hasNameFilter()) {
            parts.add(Criteria.where(DocumentFields.NAME).regex(Pattern.quote(plan.nameFilter()), "i"));
        }
        if (plan.after() != null) {
            parts.add(continuation(plan.sortField(), plan.order(), plan.after()));
        }

        Query query = new Query();
        if (parts.size() == 1) {
            query.addCriteria(parts.get(0));
        } else if (parts.size() > 1) {
            query.addCriteria(new Criteria().andOperator(parts));
        }

        Sort.Direction direction = plan.order() == SortOrder.ASC ? Sort.Direction.ASC : Sort.Direction.DESC;
        query.with(Sort.by(direction, plan.sortField()).and(Sort.by(direction, DocumentFields.ID)));
        query.limit(plan.fetchLimit());
        return query;
    }

    static Criteria continuation(String field, SortOrder order, ScrollPosition after) {
        ObjectId afterId = new ObjectId(after.id());
        Object value = DocumentMapper.toBsonValue(after.sortValue());

        if (order == SortOrder.ASC) {
            if (value == null) {
                return new Criteria().orOperator(
                        Criteria.where(field).ne(null),
                        new Criteria().andOperator(
                                Criteria.where(field).is(null),
                                Criteria.where(DocumentFields.ID).gt(afterId)));
            }
            List<Criteria> branches = new ArrayList<>();
            branches.add(Criteria.where(field).gt(value));
            branches.add(new Criteria().andOperator(
                    Criteria.where(field).is(value),
                    Criteria.where(DocumentFields.ID).gt(afterId)));
            branches.addAll(typeBranches(field, value, true));
            return new Criteria().orOperator(branches);
        }

        if (value == null) {
            return new Criteria().andOperator(
                    Criteria.where(field).is(null),
                    Criteria.where(DocumentFields.ID).lt(afterId));
        }
        List<Criteria> branches = new ArrayList<>();
        branches.add(Criteria.where(field).lt(value));
        branches.add(new Criteria().andOperator(
                Criteria.where(field).is(value),
                Criteria.where(DocumentFields.ID).lt(afterId)));
        branches.addAll(typeBranches(field, value, false));
        branches.add(Criteria.where(field).is(null));
        return new Criteria().orOperator(branches);
    }

    /**
     * {@code $gt} and {@code $lt} only match values of the same BSON type as the operand, so values of
     * the types sorting after (or before) the cursor value's type get one {@code $type} branch each.
     */
    private static List<Criteria> typeBranches(String field, Object value, boolean after) {
        int bracket = bracketOf(value);
        List<Criteria> branches = new ArrayList<>();
        if (bracket < 0) {
            return branches;
        }
        List<int[]> selected = after
                ? TYPE_BRACKETS.subList(bracket + 1, TYPE_BRACKETS.size())
                : TYPE_BRACKETS.subList(0, bracket);
        for (int[] codes : selected) {
            for (int code : codes) {
                branches.add(Criteria.where(field).type(code));
            }
        }
        return branches;
    }

    private static int bracketOf(Object value) {
        if (value instanceof Number) {
            return 0;
        }
        if (value instanceof CharSequence) {
            return 1;
        }
        if (value instanceof Map) {
            return 2;
        }
        if (value instanceof List) {
            return 3;
        }
        if (value instanceof byte[] || value instanceof Binary) {
            return 4;
        }
        if (value instanceof ObjectId) {
            return 5;
        }
        if (value instanceof Boolean) {
            return 6;
        }
        if (value instanceof Date) {
            return 7;
        }
        if (value instanceof BSONTimestamp) {
            return 8;
        }
        if (value instanceof Pattern) {
            return 9;
        }
        return -1;
    }
}
