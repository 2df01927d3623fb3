package energy.p2p.market.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import energy.p2p.market.enums.ErrorCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response envelope for every market API call
 * @param <T> Response data type
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    /**
     * HTTP status code
     */
    private Integer code;

    private String message;

    /**
     * Set on business failures only
     */
    private ErrorCategory errorCategory;

    private T data;

    @Builder.Default
    private Long timestamp = System.currentTimeMillis();

    public static <T> ApiResponse<T> success(T data) {
        return success("Success", data);
    }

    public static <T> ApiResponse<T> success(String message, T data) {
        return ApiResponse.<T>builder()
                .code(200)
                .message(message)
                .data(data)
                .build();
    }

    public static <T> ApiResponse<T> error(Integer code, String message) {
        return ApiResponse.<T>builder()
                .code(code)
                .message(message)
                .build();
    }

    /**
     * Business failure response, tagged with its category
     */
    public static <T> ApiResponse<T> error(Integer code, ErrorCategory category, String message) {
        return ApiResponse.<T>builder()
                .code(code)
                .errorCategory(category)
                .message(message)
                .build();
    }
}
