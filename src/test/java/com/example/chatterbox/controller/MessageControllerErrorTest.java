package com.example.chatterbox.controller;

import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.example.chatterbox.entity.Message;
import com.example.chatterbox.service.MessageService;
import com.example.chatterbox.service.StoreOutcome;

@WebMvcTest(MessageController.class)
class MessageControllerErrorTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MessageService messageService;

    @Test
    void storeFailureIsInternalErrorWithoutDetails() throws Exception {
        when(messageService.listAll()).thenThrow(new DataAccessResourceFailureException("connection refused to db-host:5432"));

        mockMvc.perform(get("/messages"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("Internal Server Error"))
            .andExpect(content().string(not(containsString("db-host"))));
    }

    @Test
    void integrityViolationIsBadRequest() throws Exception {
        when(messageService.create(any(), any())).thenThrow(new DataIntegrityViolationException("NOT NULL constraint"));

        mockMvc.perform(post("/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"body\": \"hi\", \"username\": \"ana\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Failed to create message due to data integrity issue."));
    }

    @Test
    void updateIntegrityViolationIsBadRequest() throws Exception {
        Message existing = Message.builder().id(3L).body("hi").username("ana").build();
        when(messageService.findById(3L)).thenReturn(StoreOutcome.ok(existing));
        when(messageService.update(anyLong(), any())).thenThrow(new DataIntegrityViolationException("value too long"));

        mockMvc.perform(patch("/messages/3")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"body\": \"hi there\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Failed to update message due to data integrity issue."));
    }

    @Test
    void deleteIntegrityViolationFallsBackToGenericMessage() throws Exception {
        when(messageService.delete(4L)).thenThrow(new DataIntegrityViolationException("fk"));

        mockMvc.perform(delete("/messages/4"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Failed to save message due to data integrity issue."));
    }

    @Test
    void invalidCreateNeverReachesStore() throws Exception {
        mockMvc.perform(post("/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"body\": \"hi\"}"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(post("/messages"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Missing required fields: 'body' and 'username'"));

        verifyNoInteractions(messageService);
    }

    @Test
    void storeSideValidationIsBadRequest() throws Exception {
        when(messageService.create("hi", "ana")).thenReturn(StoreOutcome.invalid("Body and username cannot be empty."));

        mockMvc.perform(post("/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"body\": \"hi\", \"username\": \"ana\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Body and username cannot be empty."));
    }

    @Test
    void updateFailureAfterLookupIsInternalError() throws Exception {
        Message existing = Message.builder().id(7L).body("hi").username("ana").build();
        when(messageService.findById(7L)).thenReturn(StoreOutcome.ok(existing));
        when(messageService.update(anyLong(), any())).thenThrow(new IllegalStateException("serialization failed"));

        mockMvc.perform(patch("/messages/7")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"body\": \"hi there\"}"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("Internal Server Error"));

        verify(messageService).update(7L, "hi there");
    }

    @Test
    void deleteOfMissingMessageUsesStoreMessage() throws Exception {
        when(messageService.delete(5L)).thenReturn(StoreOutcome.notFound("Message with id 5 not found"));

        mockMvc.perform(delete("/messages/5"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Message with id 5 not found"));
    }

    @Test
    void unsupportedAcceptTypeIsNotAcceptable() throws Exception {
        mockMvc.perform(get("/messages").accept(MediaType.APPLICATION_XML))
            .andExpect(status().isNotAcceptable());
    }

    @Test
    void unsupportedMethodIsJsonError() throws Exception {
        mockMvc.perform(put("/messages/5")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"body\": \"hi\"}"))
            .andExpect(status().isMethodNotAllowed())
            .andExpect(jsonPath("$.error").value("Method Not Allowed"));
    }
}
