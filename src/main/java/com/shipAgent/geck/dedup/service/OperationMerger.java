package com.shipAgent.geck.dedup.service;

import com.shipAgent.geck.dedup.exception.GroupProcessingException;
import com.shipAgent.geck.dedup.model.GroupMember;
import com.shipAgent.geck.dedup.model.MergedFields;
import com.shipAgent.geck.dedup.model.SurvivorSelection;
import com.shipAgent.geck.operations.model.OperationMetadata;
import com.shipAgent.geck.operations.model.OperationRecord;
import com.shipAgent.geck.operations.model.OperationUpdate;
import com.shipAgent.geck.operations.model.ProvenanceSnapshot;
import com.shipAgent.geck.operations.model.VariableDescriptor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Combines the metadata of every member of a duplicate group.
 * 
 * Members are merged in strategy order with the survivor first, so the survivor's own
 * category and vendor lead the merged lists and a later (less preferred) member wins on a
 * shared variable. {@link #merge} is pure and works without a store; {@link #toUpdate}
 * turns its result into the update written to the survivor.
 */
@Component
public class OperationMerger {
    
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    
    /**
     * Merges all members of a group in the order given by {@link SurvivorSelection#ordered()}.
     * 
     * @throws GroupProcessingException if a member record is missing
     */
    public MergedFields merge(String groupName, SurvivorSelection selection) {
        List<GroupMember> members = selection.ordered();
        Set<String> categories = new LinkedHashSet<>();
        Set<String> vendors = new LinkedHashSet<>();
        Set<String> tags = new LinkedHashSet<>();
        Map<String, VariableDescriptor> variables = new LinkedHashMap<>();
        List<ProvenanceSnapshot> sources = new ArrayList<>();
        boolean required = false;
        
        for (GroupMember member : members) {
            OperationRecord operation = member.operation();
            if (operation == null) {
                throw new GroupProcessingException(groupName,
                        "Member #" + member.sequence() + " of group '" + groupName + "' has no record");
            }
            if (StringUtils.hasLength(operation.getCategory())) {
                categories.add(operation.getCategory());
            }
            if (StringUtils.hasLength(operation.getVendor())) {
                vendors.add(operation.getVendor());
            }
            if (operation.getTags() != null) {
                operation.getTags().stream()
                        .filter(StringUtils::hasLength)
                        .forEach(tags::add);
            }
            if (operation.getVariables() != null) {
                variables.putAll(operation.getVariables());
            }
            required |= Boolean.TRUE.equals(operation.getRequired());
            sources.add(ProvenanceSnapshot.of(operation));
        }
        
        tags.addAll(categories);
        vendors.forEach(vendor -> tags.add(normalizeVendorTag(vendor)));
        
        return MergedFields.builder()
                .categories(new ArrayList<>(categories))
                .vendors(new ArrayList<>(vendors))
                .bestDescription(longest(members, OperationRecord::getDescription))
                .bestQuery(longest(members, OperationRecord::getQuery))
                .tags(new ArrayList<>(tags))
                .variables(variables)
                .required(required)
                .sources(sources)
                .build();
    }
    
    /**
     * Builds the update for the survivor. Description and query are only replaced by a
     * strictly longer value; tags and variables only when the merge produced any.
     */
    public OperationUpdate toUpdate(OperationRecord survivor, MergedFields merged, Instant now) {
        OperationUpdate.OperationUpdateBuilder update = OperationUpdate.builder()
                .updatedAt(now)
                .required(merged.isRequired())
                .metadata(OperationMetadata.builder()
                        .categories(merged.getCategories())
                        .vendors(merged.getVendors())
                        .sources(merged.getSources())
                        .build())
                .category(firstOrElse(merged.getCategories(), survivor.getCategory()))
                .vendor(firstOrElse(merged.getVendors(), survivor.getVendor()));
        
        if (isLonger(merged.getBestDescription(), survivor.getDescription())) {
            update.description(merged.getBestDescription());
        }
        if (isLonger(merged.getBestQuery(), survivor.getQuery())) {
            update.query(merged.getBestQuery());
        }
        if (!merged.getTags().isEmpty()) {
            update.tags(merged.getTags());
        }
        if (!merged.getVariables().isEmpty()) {
            update.variables(merged.getVariables());
        }
        return update.build();
    }
    
    static String normalizeVendorTag(String vendor) {
        return WHITESPACE.matcher(vendor.toLowerCase(Locale.ROOT)).replaceAll("-");
    }
    
    /**
     * First longest non-empty value; ties go to the earlier member, the survivor first.
     */
    private static String longest(List<GroupMember> members, Function<OperationRecord, String> field) {
        String best = null;
        for (GroupMember member : members) {
            String candidate = field.apply(member.operation());
            if (StringUtils.hasLength(candidate) && (best == null || candidate.length() > best.length())) {
                best = candidate;
            }
        }
        return best;
    }
    
    private static boolean isLonger(String candidate, String current) {
        if (candidate == null) {
            return false;
        }
        return !StringUtils.hasLength(current) || candidate.length() > current.length();
    }
    
    private static String firstOrElse(List<String> values, String fallback) {
        return values.isEmpty() ? fallback : values.get(0);
    }
}
