package com.example.movies.storage;

import com.example.movies.security.AuthorizationDeniedException;
import com.example.movies.security.SecurityBoundary;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.dynamodb.DynamoDbAsyncClient;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.CreateTableResponse;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableResponse;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.waiters.DynamoDbAsyncWaiter;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class TableProvisionerTest {

    private static final StorageIdentity MOVIES =
            new StorageIdentity("Movies", "arn:aws:dynamodb:us-east-1:000000000000:table/Movies");

    @Mock
    private DynamoDbAsyncClient dynamoDbAsyncClient;

    @Mock
    private DynamoDbAsyncWaiter waiter;

    @Test
    void existingTableIsLeftAlone() {
        given(dynamoDbAsyncClient.describeTable(any(DescribeTableRequest.class)))
                .willReturn(CompletableFuture.completedFuture(DescribeTableResponse.builder().build()));

        boolean created = new TableProvisioner(dynamoDbAsyncClient, SecurityBoundary.forTableProvisioning(MOVIES))
                .ensureTable(MOVIES);

        assertThat(created).isFalse();
        verify(dynamoDbAsyncClient, never()).createTable(any(CreateTableRequest.class));
    }

    @Test
    void missingTableIsCreatedFromSchema() {
        given(dynamoDbAsyncClient.describeTable(any(DescribeTableRequest.class)))
                .willReturn(CompletableFuture.failedFuture(ResourceNotFoundException.builder().message("nope").build()));
        given(dynamoDbAsyncClient.createTable(any(CreateTableRequest.class)))
                .willReturn(CompletableFuture.completedFuture(CreateTableResponse.builder().build()));
        given(dynamoDbAsyncClient.waiter()).willReturn(waiter);
        given(waiter.waitUntilTableExists(any(DescribeTableRequest.class)))
                .willReturn(CompletableFuture.completedFuture(null));

        boolean created = new TableProvisioner(dynamoDbAsyncClient, SecurityBoundary.forTableProvisioning(MOVIES))
                .ensureTable(MOVIES);

        assertThat(created).isTrue();
        verify(dynamoDbAsyncClient).createTable(StorageSchema.createTableRequest("Movies"));
    }

    @Test
    void tableOutsideTheGrantIsNotTouched() {
        StorageIdentity users = new StorageIdentity("Users", "arn:aws:dynamodb:us-east-1:000000000000:table/Users");
        TableProvisioner provisioner =
                new TableProvisioner(dynamoDbAsyncClient, SecurityBoundary.forTableProvisioning(MOVIES));

        assertThatThrownBy(() -> provisioner.ensureTable(users)).isInstanceOf(AuthorizationDeniedException.class);
        verifyNoInteractions(dynamoDbAsyncClient);
    }
}
