package com.example.sqlsplitter.service.sql.split;

import lombok.Builder;
import lombok.Value;

/**
 * Trạng thái lồng nhau của statement đang đọc. Immutable: mỗi token có nghĩa
 * sinh ra một state mới qua {@link StatementBoundaryMachine#transition}.
 */
@Value
@Builder(toBuilder = true)
public class SplitState {
    int blockDepth;              // số BEGIN (không phải transaction) chưa gặp END
    int caseDepth;               // CASE ... END đang mở
    boolean inProceduralHeader;  // sau DECLARE/FUNCTION/PROCEDURE, trước BEGIN
    boolean inPackage;
    String packageName;
    boolean inCreateOrAlter;
    String previousWord;         // token có nghĩa ngay trước đó (upper case), null nếu không phải word

    public static SplitState initial() {
        return SplitState.builder().build();
    }

    /** Terminator chỉ kết thúc statement khi ở ngoài mọi block/header/package. */
    public boolean isAtTopLevel() {
        return blockDepth == 0 && !inProceduralHeader && !inPackage;
    }
}
