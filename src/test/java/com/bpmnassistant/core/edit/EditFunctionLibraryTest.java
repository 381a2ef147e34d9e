package com.bpmnassistant.core.edit;

import com.bpmnassistant.core.model.ExclusiveBranch;
import com.bpmnassistant.core.model.ProcessElement;
import com.bpmnassistant.core.model.ProcessJsonCodec;
import com.bpmnassistant.core.model.ProcessTree;
import com.bpmnassistant.core.validation.ProcessValidator;
import com.bpmnassistant.core.validation.SchemaViolationException;
import com.bpmnassistant.support.ProcessFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.bpmnassistant.support.ProcessFixtures.json;
import static com.bpmnassistant.support.ProcessFixtures.tree;
import static org.junit.jupiter.api.Assertions.*;

class EditFunctionLibraryTest {

    private final EditFunctionLibrary library =
            new EditFunctionLibrary(new ProcessValidator(), new ProcessJsonCodec());
    private final EditProposalValidator proposals = new EditProposalValidator();

    private static List<String> ids(ProcessTree tree) {
        return tree.getElements().stream().map(ProcessElement::getId).toList();
    }

    private static List<String> ids(List<ProcessElement> sequence) {
        return sequence.stream().map(ProcessElement::getId).toList();
    }

    // =========================================================================
    // delete_element
    // =========================================================================

    @Test
    void testDeleteTopLevel() throws Exception {
        ProcessTree result = library.deleteElement(tree(ProcessFixtures.LINEAR), "B");
        assertEquals(List.of("A", "C"), ids(result));
    }

    @Test
    void testDeleteNestedRemovesSubtree() throws Exception {
        ProcessTree result = library.deleteElement(tree(ProcessFixtures.NESTED), "par");

        assertFalse(result.contains("par"));
        assertFalse(result.contains("pack"));
        assertFalse(result.contains("invoice"));
        assertEquals(List.of("pick"),
                ids(result.find("gw").orElseThrow().getExclusiveBranches().get(0).getPath()));
    }

    @Test
    void testDeleteUnknownFails() {
        StructuralEditException e = assertThrows(StructuralEditException.class,
                () -> library.deleteElement(tree(ProcessFixtures.LINEAR), "Z"));
        assertTrue(e.getMessage().contains("'Z'"));
    }

    @Test
    void testInputTreeUntouched() throws Exception {
        ProcessTree original = tree(ProcessFixtures.NESTED);
        ProcessTree copy = tree(ProcessFixtures.NESTED);

        library.deleteElement(original, "pack");
        library.moveElement(original, "notify", ElementAnchor.after("end"));

        assertEquals(copy, original);
    }

    // =========================================================================
    // add_element
    // =========================================================================

    @Test
    void testAddBeforeAndAfter() throws Exception {
        ProcessTree linear = tree(ProcessFixtures.LINEAR);

        ProcessTree before = library.addElement(linear, ProcessElement.task("X", "New"), ElementAnchor.before("A"));
        assertEquals(List.of("X", "A", "B", "C"), ids(before));

        ProcessTree after = library.addElement(linear, ProcessElement.task("X", "New"), ElementAnchor.after("C"));
        assertEquals(List.of("A", "B", "C", "X"), ids(after));
    }

    @Test
    void testAddAtAnchorDepth() throws Exception {
        ProcessTree result = library.addElement(tree(ProcessFixtures.NESTED),
                ProcessElement.task("label", "Print label"), ElementAnchor.after("pack"));

        assertEquals(List.of("pack", "label"),
                ids(result.find("par").orElseThrow().getParallelBranches().get(0)));
        assertEquals(List.of("start", "gw", "end"), ids(result));
    }

    @Test
    void testAddDuplicateIdFails() {
        assertThrows(StructuralEditException.class, () -> library.addElement(tree(ProcessFixtures.LINEAR),
                ProcessElement.task("B", "Again"), ElementAnchor.after("A")));
    }

    @Test
    void testAddGatewayWithExistingNestedIdFails() {
        ProcessElement gateway = ProcessElement.exclusiveGateway("G", "Ok?",
                List.of(new ExclusiveBranch("yes", List.of(ProcessElement.task("C", "Clash")))));
        assertThrows(StructuralEditException.class, () -> library.addElement(tree(ProcessFixtures.LINEAR),
                gateway, ElementAnchor.after("A")));
    }

    @Test
    void testAddMissingAnchorFails() {
        assertThrows(StructuralEditException.class, () -> library.addElement(tree(ProcessFixtures.LINEAR),
                ProcessElement.task("X", "New"), ElementAnchor.after("nope")));
    }

    // =========================================================================
    // move_element
    // =========================================================================

    @Test
    void testMoveAfterSibling() throws Exception {
        ProcessTree result = library.moveElement(tree(ProcessFixtures.LINEAR), "A", ElementAnchor.after("B"));
        assertEquals(List.of("B", "A", "C"), ids(result));
    }

    @Test
    void testMoveOutOfBranch() throws Exception {
        ProcessTree result = library.moveElement(tree(ProcessFixtures.NESTED), "notify", ElementAnchor.before("end"));

        assertEquals(List.of("start", "gw", "notify", "end"), ids(result));
        assertTrue(result.find("gw").orElseThrow().getExclusiveBranches().get(1).getPath().isEmpty());
    }

    @Test
    void testMoveIntoOwnSubtreeFails() {
        StructuralEditException e = assertThrows(StructuralEditException.class,
                () -> library.moveElement(tree(ProcessFixtures.NESTED), "gw", ElementAnchor.after("pack")));
        assertTrue(e.getMessage().contains("inside the moved element"));
    }

    @Test
    void testMoveUnknownFails() {
        assertThrows(StructuralEditException.class,
                () -> library.moveElement(tree(ProcessFixtures.LINEAR), "Z", ElementAnchor.after("A")));
        assertThrows(StructuralEditException.class,
                () -> library.moveElement(tree(ProcessFixtures.LINEAR), "A", ElementAnchor.after("Z")));
    }

    // =========================================================================
    // update_element
    // =========================================================================

    @Test
    void testUpdateKeepsPosition() throws Exception {
        ProcessTree result = library.updateElement(tree(ProcessFixtures.NESTED),
                ProcessElement.task("pack", "Pack and seal"));

        ProcessElement updated = result.find("pack").orElseThrow();
        assertEquals("Pack and seal", updated.getLabel());
        assertEquals(List.of("pack"), ids(result.find("par").orElseThrow().getParallelBranches().get(0)));
    }

    @Test
    void testUpdateIsIdempotent() throws Exception {
        ProcessElement element = ProcessElement.task("B", "Check stock twice");
        ProcessTree once = library.updateElement(tree(ProcessFixtures.LINEAR), element);
        ProcessTree twice = library.updateElement(once, element);

        assertEquals(once, twice);
    }

    @Test
    void testUpdateUnknownFails() {
        assertThrows(StructuralEditException.class, () -> library.updateElement(tree(ProcessFixtures.LINEAR),
                ProcessElement.task("Z", "Nothing")));
    }

    @Test
    void testUpdateIntroducingDuplicateFails() {
        ProcessElement gateway = ProcessElement.parallelGateway("B",
                List.of(List.of(ProcessElement.task("C", "Clash"))));
        assertThrows(StructuralEditException.class,
                () -> library.updateElement(tree(ProcessFixtures.LINEAR), gateway));
    }

    // =========================================================================
    // redirect_branch
    // =========================================================================

    @Test
    void testRedirectSetsNext() throws Exception {
        ProcessTree result = library.redirectBranch(tree(ProcessFixtures.NESTED), "out of stock", "end");

        List<ExclusiveBranch> branches = result.find("gw").orElseThrow().getExclusiveBranches();
        assertEquals("end", branches.get(1).getNext());
        assertNull(branches.get(0).getNext());
        assertTrue(result.contains("end"));
    }

    @Test
    void testRedirectUnknownConditionFails() {
        StructuralEditException e = assertThrows(StructuralEditException.class,
                () -> library.redirectBranch(tree(ProcessFixtures.NESTED), "maybe", "end"));
        assertEquals("Branch with condition 'maybe' not found in the process.", e.getMessage());
    }

    @Test
    void testRedirectUnknownTargetFails() {
        assertThrows(StructuralEditException.class,
                () -> library.redirectBranch(tree(ProcessFixtures.NESTED), "in stock", "nowhere"));
    }

    @Test
    void testRedirectPicksFirstMatchInDocumentOrder() throws Exception {
        ProcessTree twoGateways = tree("""
                [ {'type':'exclusiveGateway','id':'g1','label':'First?','branches':[
                    {'condition':'yes','path':[
                        {'type':'exclusiveGateway','id':'g2','label':'Inner?','branches':[
                            {'condition':'yes','path':[]} ]} ]} ]},
                  {'type':'task','id':'end','label':'End'} ]
                """);

        ProcessTree result = library.redirectBranch(twoGateways, "yes", "end");

        assertEquals("end", result.find("g1").orElseThrow().getExclusiveBranches().get(0).getNext());
        assertNull(result.find("g2").orElseThrow().getExclusiveBranches().get(0).getNext());
    }

    // =========================================================================
    // apply
    // =========================================================================

    @Test
    void testApplyDispatchesProposal() throws Exception {
        EditProposal proposal = proposals.validate(json("""
                {'function':'add_element','arguments':{
                    'element':{'type':'serviceTask','id':'X','label':'Email customer'},'before_id':'end'}}
                """), false);

        ProcessTree result = library.apply(tree(ProcessFixtures.NESTED), proposal);

        assertEquals(List.of("start", "gw", "X", "end"), ids(result));
    }

    @Test
    void testApplyRejectsInvalidElement() throws Exception {
        EditProposal proposal = proposals.validate(json("""
                {'function':'update_element','arguments':{'new_element':{'type':'task','id':'A'}}}
                """), false);

        StructuralEditException e = assertThrows(StructuralEditException.class,
                () -> library.apply(tree(ProcessFixtures.LINEAR), proposal));
        assertTrue(e.getMessage().startsWith("Invalid element:"));
    }

    @Test
    void testApplyStopIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> library.apply(tree(ProcessFixtures.LINEAR), EditProposal.stop()));
    }

    @Test
    void testDeletingRedirectTargetLeavesTreeTheValidatorRejects() throws Exception {
        ProcessJsonCodec codec = new ProcessJsonCodec();
        ProcessTree redirected = library.redirectBranch(tree(ProcessFixtures.NESTED), "out of stock", "end");
        ProcessTree deleted = library.deleteElement(redirected, "end");

        assertFalse(deleted.contains("end"));
        assertThrows(SchemaViolationException.class,
                () -> new ProcessValidator().validate(codec.encode(deleted)));
    }
}
