package cn.bafuka.tierstore.support;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 测试用值类型
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Product {

    private String id;

    private String name;

    private int price;
}
