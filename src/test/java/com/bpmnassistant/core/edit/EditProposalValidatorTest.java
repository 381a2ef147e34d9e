package com.bpmnassistant.core.edit;

import com.bpmnassistant.core.validation.SchemaViolationException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static com.bpmnassistant.support.ProcessFixtures.json;
import static org.junit.jupiter.api.Assertions.*;

class EditProposalValidatorTest {

    private final EditProposalValidator validator = new EditProposalValidator();

    @Test
    void testDeleteElementAccepted() throws Exception {
        EditProposal proposal = validator.validate(
                json("{'function':'delete_element','arguments':{'element_id':'B'}}"), false);

        assertFalse(proposal.isStop());
        assertEquals(EditFunction.DELETE_ELEMENT, proposal.getFunction());
        assertEquals("B", proposal.getArguments().get("element_id").asText());
    }

    @Test
    void testExtraArgumentRejected() {
        SchemaViolationException e = assertThrows(SchemaViolationException.class, () -> validator.validate(
                json("{'function':'delete_element','arguments':{'element_id':'B','foo':1}}"), false));
        assertTrue(e.getMessage().contains("foo"));
    }

    @Test
    void testMissingArgumentRejected() {
        SchemaViolationException e = assertThrows(SchemaViolationException.class, () -> validator.validate(
                json("{'function':'redirect_branch','arguments':{'branch_condition':'yes'}}"), false));
        assertTrue(e.getMessage().contains("'next_id'"));
    }

    @Test
    void testUnknownFunctionListsSupportedOnes() {
        SchemaViolationException e = assertThrows(SchemaViolationException.class, () -> validator.validate(
                json("{'function':'rename_element','arguments':{}}"), false));
        assertTrue(e.getMessage().startsWith("Function 'rename_element' not found"));
        assertTrue(e.getMessage().contains("update_element"));
    }

    @Test
    void testMissingFunctionOrArgumentsRejected() {
        assertThrows(SchemaViolationException.class,
                () -> validator.validate(json("{'function':'delete_element'}"), true));
        assertThrows(SchemaViolationException.class,
                () -> validator.validate(json("{'arguments':{'element_id':'A'}}"), true));
        assertThrows(SchemaViolationException.class,
                () -> validator.validate(json("[1, 2]"), true));
    }

    @Test
    void testArgumentsMustBeObject() {
        assertThrows(SchemaViolationException.class, () -> validator.validate(
                json("{'function':'delete_element','arguments':'B'}"), false));
    }

    @Test
    void testAnchoredVerbNeedsExactlyOneAnchor() {
        SchemaViolationException both = assertThrows(SchemaViolationException.class, () -> validator.validate(
                json("{'function':'move_element','arguments':{'element_id':'A','before_id':'B','after_id':'C'}}"),
                false));
        assertTrue(both.getMessage().startsWith("Only one of"));

        SchemaViolationException neither = assertThrows(SchemaViolationException.class, () -> validator.validate(
                json("{'function':'move_element','arguments':{'element_id':'A'}}"), false));
        assertTrue(neither.getMessage().startsWith("Either"));
    }

    @Test
    void testAnchorOnUnanchoredVerbRejected() {
        assertThrows(SchemaViolationException.class, () -> validator.validate(
                json("{'function':'delete_element','arguments':{'element_id':'A','after_id':'B'}}"), false));
    }

    @Test
    void testAddElementAccepted() throws Exception {
        EditProposal proposal = validator.validate(json("""
                {'function':'add_element','arguments':{
                    'element':{'type':'task','id':'X','label':'New'},'after_id':'A'}}
                """), false);

        assertEquals(EditFunction.ADD_ELEMENT, proposal.getFunction());
        assertEquals(ElementAnchor.Position.AFTER, proposal.anchor().getPosition());
        assertEquals("A", proposal.anchor().getTargetId());
    }

    @Test
    void testElementArgumentMustBeObject() {
        assertThrows(SchemaViolationException.class, () -> validator.validate(
                json("{'function':'update_element','arguments':{'new_element':'A'}}"), false));
    }

    @Test
    void testIdArgumentMustBeNonEmptyString() {
        assertThrows(SchemaViolationException.class, () -> validator.validate(
                json("{'function':'delete_element','arguments':{'element_id':''}}"), false));
        assertThrows(SchemaViolationException.class, () -> validator.validate(
                json("{'function':'delete_element','arguments':{'element_id':7}}"), false));
    }

    @Test
    void testStopOnlyAcceptedAfterFirstEdit() throws Exception {
        assertThrows(SchemaViolationException.class,
                () -> validator.validate(json("{'stop':true}"), false));

        assertTrue(validator.validate(json("{'stop':true}"), true).isStop());
    }

    @Test
    void testArgumentsAreCopied() throws Exception {
        ObjectNode response = (ObjectNode) json("{'function':'delete_element','arguments':{'element_id':'B'}}");
        EditProposal proposal = validator.validate(response, false);

        ((ObjectNode) response.get("arguments")).put("element_id", "C");

        assertEquals("B", proposal.getArguments().get("element_id").asText());
    }
}
