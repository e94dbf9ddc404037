package com.codeheadsystems.blog.store;

import com.codeheadsystems.blog.exception.StoreUnavailableException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughputExceededException;
import software.amazon.awssdk.services.dynamodb.model.RequestLimitExceededException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

/**
 * Runs DynamoDB client calls, turning transport failures, throttling, server errors and a missing
 * table into {@link StoreUnavailableException}. Conditional check failures and other rejected
 * requests pass through for the caller.
 */
public final class DynamoDbCalls {

  private static final Logger log = LoggerFactory.getLogger(DynamoDbCalls.class);

  private DynamoDbCalls() {
  }

  /**
   * Call the client.
   *
   * @param <T>       the response type
   * @param operation name used in logs and messages
   * @param tableName the table the call is against
   * @param supplier  the client call
   * @return the response
   */
  public static <T> T call(final String operation, final String tableName, final Supplier<T> supplier) {
    try {
      return supplier.get();
    } catch (ConditionalCheckFailedException e) {
      throw e;
    } catch (ResourceNotFoundException e) {
      log.error("{}: table {} not found", operation, tableName, e);
      throw new StoreUnavailableException("Table " + tableName + " does not exist", e);
    } catch (ProvisionedThroughputExceededException | RequestLimitExceededException e) {
      log.warn("{}: throttled", operation, e);
      throw new StoreUnavailableException("Store throttled during " + operation, e);
    } catch (AwsServiceException e) {
      if (e.isThrottlingException() || e.statusCode() >= 500) {
        log.warn("{}: store unavailable", operation, e);
        throw new StoreUnavailableException("Store unavailable during " + operation, e);
      }
      log.error("{}: request rejected", operation, e);
      throw e;
    } catch (SdkClientException e) {
      log.warn("{}: unable to reach store", operation, e);
      throw new StoreUnavailableException("Unable to reach store during " + operation, e);
    }
  }

}
